package com.health.compliance.model;

/**
 * How an access reason was supplied. ABSENT means no reason was sent at all, EMPTY that one was
 * sent blank. Every status but PROVIDED counts as a missing reason.
 */
public enum ReasonStatus {
    ABSENT,
    EMPTY,
    PLACEHOLDER,
    PROVIDED;

    public static ReasonStatus classify(String reason, String sentinel) {
        if (reason == null) return ABSENT;
        if (reason.isBlank()) return EMPTY;
        if (reason.trim().equalsIgnoreCase(sentinel)) return PLACEHOLDER;
        return PROVIDED;
    }

    public boolean isMissing() {
        return this != PROVIDED;
    }
}
