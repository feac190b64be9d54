package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComplianceReport {
    private String reportId;
    private ReportType reportType;
    private LocalDate reportDate;
    private LocalDate startDate;
    private LocalDate endDate;
    private String requestedBy;         // null for scheduled reports
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;
    private ArtifactFormat format;
    @Builder.Default
    private Map<String, String> parameters = new LinkedHashMap<>();
    private String artifactPath;        // set only on COMPLETED
    private String notes;
    private long createdAt;
    private long updatedAt;
    private String idempotencyKey;
}
