package com.health.compliance.model;

public enum RiskLevel {
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    CRITICAL("Critical");

    private final String label;

    RiskLevel(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RiskLevel fromScore(int score) {
        if (score > 70) return CRITICAL;
        if (score > 50) return HIGH;
        if (score > 30) return MEDIUM;
        return LOW;
    }
}
