package com.health.compliance.model;

public enum LogStream {
    ACTIVITY,
    ACCESS,
    SECURITY
}
