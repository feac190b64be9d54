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
public class ExportRequest {
    private String stream;              // ACTIVITY, ACCESS or SECURITY
    private String requestedBy;
    private Map<String, String> filters;
}
