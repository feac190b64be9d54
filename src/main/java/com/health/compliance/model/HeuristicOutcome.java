package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeuristicOutcome {

    public enum Status { SUCCEEDED, FAILED, DISABLED }

    private String heuristic;
    private Status status;
    private int candidates;
    private int alertsRaised;
    private int duplicatesSkipped;
    private String error;
}
