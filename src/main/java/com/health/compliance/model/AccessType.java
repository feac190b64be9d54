package com.health.compliance.model;

public enum AccessType {
    VIEW,
    MODIFY,
    EXPORT,
    SHARE,
    PRINT;

    public static AccessType fromMethod(String method) {
        return "GET".equalsIgnoreCase(method) ? VIEW : MODIFY;
    }

    public boolean isDisclosure() {
        return this == SHARE || this == EXPORT;
    }
}
