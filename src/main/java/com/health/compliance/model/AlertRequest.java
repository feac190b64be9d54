package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRequest {
    private String eventType;
    private String description;
    private String severity;            // defaults to MEDIUM
    private String actorId;
    private String actorUsername;
    private String actorRole;
    private String ipAddress;
    private String userAgent;
    private Map<String, Object> context;
}
