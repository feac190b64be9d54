package com.health.compliance.exception;

/**
 * Writing a rendered artifact to storage failed. Retried before the job is failed.
 */
public class ArtifactWriteException extends RuntimeException {

    public ArtifactWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
