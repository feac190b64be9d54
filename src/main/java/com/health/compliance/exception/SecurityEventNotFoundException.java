package com.health.compliance.exception;

public class SecurityEventNotFoundException extends RuntimeException {

    public SecurityEventNotFoundException(String id) {
        super("Security event not found: " + id);
    }
}
