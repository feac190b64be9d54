package com.health.compliance.exception;

public class ExportNotFoundException extends RuntimeException {

    public ExportNotFoundException(String id) {
        super("Data export not found: " + id);
    }
}
