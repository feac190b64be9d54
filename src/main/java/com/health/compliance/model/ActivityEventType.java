package com.health.compliance.model;

public enum ActivityEventType {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    LOGIN,
    LOGOUT,
    ACCESS,
    ERROR,
    PASSWORD_RESET,
    ACCOUNT_LOCKOUT,
    PERMISSION_CHANGE;

    public static ActivityEventType fromMethod(String method) {
        if (method == null) return ACCESS;
        return switch (method.toUpperCase()) {
            case "GET" -> READ;
            case "POST" -> CREATE;
            case "PUT", "PATCH" -> UPDATE;
            case "DELETE" -> DELETE;
            default -> ACCESS;
        };
    }
}
