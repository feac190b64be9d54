package com.health.compliance.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inputs to the risk score, counted over the risk window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskFactors {
    private boolean unresolvedCritical;
    private long highOrCriticalCount;
    private long suspiciousAccessCount;
    private long permissionViolationCount;
    private long repeatLoginFailureGroups;
}
