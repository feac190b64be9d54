package com.health.compliance.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionRunReport {
    private long windowStart;
    private long windowEnd;
    private long startedAt;
    private long completedAt;
    @Builder.Default
    private List<HeuristicOutcome> outcomes = new ArrayList<>();

    @JsonProperty("alertsRaised")
    public int getAlertsRaised() {
        return outcomes.stream().mapToInt(HeuristicOutcome::getAlertsRaised).sum();
    }

    @JsonProperty("failedHeuristics")
    public List<String> getFailedHeuristics() {
        return outcomes.stream()
                .filter(o -> o.getStatus() == HeuristicOutcome.Status.FAILED)
                .map(HeuristicOutcome::getHeuristic)
                .toList();
    }

    @JsonProperty("partialSuccess")
    public boolean isPartialSuccess() {
        return !getFailedHeuristics().isEmpty();
    }
}
