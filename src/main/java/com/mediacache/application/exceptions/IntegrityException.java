package com.mediacache.application.exceptions;

/**
 * Checksum or content mismatch.
 */
public class IntegrityException extends CacheEngineException {

    public IntegrityException(String message) {
        super(ErrorCode.INTEGRITY, message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY, message, cause);
    }
}
