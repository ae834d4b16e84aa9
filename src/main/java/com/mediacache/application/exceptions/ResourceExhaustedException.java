package com.mediacache.application.exceptions;

/**
 * Pool checkout, lock or operation timeout, or a saturated worker queue.
 */
public class ResourceExhaustedException extends CacheEngineException {

    public ResourceExhaustedException(String message) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(ErrorCode.RESOURCE_EXHAUSTED, message, cause);
    }
}
