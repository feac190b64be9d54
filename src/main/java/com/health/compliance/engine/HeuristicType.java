package com.health.compliance.engine;

public enum HeuristicType {
    HIGH_VOLUME_ACCESS,
    DISTINCT_SUBJECT_ACCESS,
    AFTER_HOURS_ACCESS,
    OUTSIDE_CASELOAD_ACCESS,
    RAPID_ACCESS,
    BRUTE_FORCE_LOGIN,
    FLAGGED_SUBJECT_ACCESS
}
