package com.mediacache.application.exceptions;

/**
 * The caller exceeded its request quota for the current window.
 */
public class RateLimitException extends CacheEngineException {

    public RateLimitException(String message) {
        super(ErrorCode.RATE_LIMITED, message);
    }

    public RateLimitException(String message, Throwable cause) {
        super(ErrorCode.RATE_LIMITED, message, cause);
    }
}
