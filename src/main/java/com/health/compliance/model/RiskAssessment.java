package com.health.compliance.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Organizational security risk over a rolling window")
public class RiskAssessment {

    @Schema(description = "Score 0-100", example = "76")
    private int score;

    private RiskLevel level;

    @Schema(example = "Critical")
    private String levelLabel;

    private RiskFactors factors;
    private int windowDays;
    private long totalEvents;
    private long unresolvedEvents;
    private Map<String, Long> bySeverity;
    private Map<String, Long> byType;

    @Schema(description = "Security events per week over the trend window, oldest first")
    private List<Map<String, Object>> weeklyTrend;

    private long generatedAt;
}
