package com.mediacache.application.exceptions;

public class OperationCancelledException extends CacheEngineException {

    public OperationCancelledException(String message) {
        super(ErrorCode.CANCELLED, message);
    }
}
