package com.mediacache.application.exceptions;

/**
 * Bad path, filename, size or request parameter.
 */
public class ValidationException extends CacheEngineException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorCode.VALIDATION, message, cause);
    }
}
