package com.health.compliance.exception;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String id) {
        super("Compliance report not found: " + id);
    }
}
