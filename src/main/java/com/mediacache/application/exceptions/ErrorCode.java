package com.mediacache.application.exceptions;

/**
 * Closed set of failure categories surfaced at the operation boundary.
 */
public enum ErrorCode {
    VALIDATION,
    AUTHORIZATION,
    RATE_LIMITED,
    CONFLICT,
    INTEGRITY,
    RESOURCE_EXHAUSTED,
    FILESYSTEM,
    CANCELLED,
    INTERNAL;

    /**
     * Validation, authorization and rate-limit failures are raised before any filesystem
     * mutation and may be retried once the caller corrects the cause.
     */
    public boolean isDetectedBeforeMutation() {
        return this == VALIDATION || this == AUTHORIZATION || this == RATE_LIMITED;
    }
}
