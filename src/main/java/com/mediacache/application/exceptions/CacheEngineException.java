package com.mediacache.application.exceptions;

/**
 * Root of every failure raised by the cache engine.
 *
 * @since 1.0.0
 */
public abstract class CacheEngineException extends RuntimeException {

    private final ErrorCode code;

    protected CacheEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected CacheEngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
