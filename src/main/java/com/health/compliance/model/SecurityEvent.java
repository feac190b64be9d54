package com.health.compliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Security event. Resolution fields are the only part that changes after creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A security alert, open until resolved by an authorized actor")
public class SecurityEvent {

    private String eventId;
    private String actorId;
    private String actorUsername;
    private String actorRole;
    private SecurityEventType eventType;
    private String description;

    @Builder.Default
    private Severity severity = Severity.MEDIUM;

    private String ipAddress;
    private String userAgent;
    private long timestamp;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    private boolean resolved;
    private String resolvedBy;
    private long resolvedAt;            // 0 while open
    private String resolutionNotes;

    @Schema(description = "Set on aggregate alerts so reruns over an overlapping window do not repeat them")
    private String dedupKey;
}
