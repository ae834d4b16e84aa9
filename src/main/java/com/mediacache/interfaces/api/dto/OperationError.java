package com.mediacache.interfaces.api.dto;

import com.mediacache.application.exceptions.ErrorCode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Typed failure returned at the operation boundary. Carries no stack trace and no
 * internal detail beyond a sanitised message.
 */
@Value
@Builder
public class OperationError {
    UUID requestId;
    Instant timestamp;
    String operation;
    ErrorCode code;
    String message;

    /**
     * True when the failure was detected before any mutation and the caller may retry
     * after correcting the cause.
     */
    public boolean isRetryableAfterCorrection() {
        return code != null && code.isDetectedBeforeMutation();
    }
}
