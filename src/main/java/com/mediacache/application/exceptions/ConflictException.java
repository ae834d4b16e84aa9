package com.mediacache.application.exceptions;

/**
 * The path is locked by another relocation or already in a conflicting state.
 */
public class ConflictException extends CacheEngineException {

    public ConflictException(String message) {
        super(ErrorCode.CONFLICT, message);
    }

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
