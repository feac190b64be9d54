package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DataExport {
    private String exportId;
    private String requestedBy;
    private LogStream stream;
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;
    @Builder.Default
    private Map<String, String> filters = new LinkedHashMap<>();
    private String artifactPath;
    private long createdAt;
    private long updatedAt;
    private long completedAt;           // 0 until terminal
    private String errorMessage;
}
