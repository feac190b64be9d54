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
public class ReportRequest {
    private String reportType;
    private String startDate;           // YYYY-MM-DD
    private String endDate;             // YYYY-MM-DD
    private String requestedBy;
    private String format;              // JSON or CSV, defaults per report type
    private Map<String, String> parameters;
}
