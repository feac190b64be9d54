package com.health.compliance.model;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isHighOrCritical() {
        return this == HIGH || this == CRITICAL;
    }
}
