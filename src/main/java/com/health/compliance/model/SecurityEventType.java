package com.health.compliance.model;

public enum SecurityEventType {
    LOGIN_FAILED,
    SUSPICIOUS_ACCESS,
    PERMISSION_VIOLATION,
    BRUTE_FORCE_ATTEMPT,
    UNUSUAL_ACTIVITY,
    SYSTEM_ERROR
}
