package com.mediacache.application.exceptions;

/**
 * The caller's role lacks the requested permission.
 */
public class AuthorizationException extends CacheEngineException {

    public AuthorizationException(String message) {
        super(ErrorCode.AUTHORIZATION, message);
    }

    public AuthorizationException(String message, Throwable cause) {
        super(ErrorCode.AUTHORIZATION, message, cause);
    }
}
