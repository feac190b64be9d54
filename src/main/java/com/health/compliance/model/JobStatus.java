package com.health.compliance.model;

/**
 * Status of a report or export job. Transitions only move forward:
 * PENDING to PROCESSING, PROCESSING to COMPLETED or FAILED. A pending job that can never be
 * started (for example, it could not be enqueued) may go straight to FAILED.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(JobStatus next) {
        return switch (this) {
            case PENDING -> next == PROCESSING || next == FAILED;
            case PROCESSING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
