package com.mediacache.interfaces.api.dto;

import com.mediacache.application.exceptions.ErrorCode;

import java.util.Objects;

/**
 * Either a value or an {@link OperationError}. Operations on the public surface return this
 * instead of throwing.
 *
 * @param <T> value type
 */
public final class OperationResult<T> {

    private final T value;
    private final OperationError error;

    private OperationResult(T value, OperationError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static <T> OperationResult<T> failure(OperationError error) {
        return new OperationResult<>(null, Objects.requireNonNull(error));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new IllegalStateException("Operation failed with " + error.getCode() + ": " + error.getMessage());
        }
        return value;
    }

    public OperationError getError() {
        return error;
    }

    public ErrorCode getErrorCode() {
        return error == null ? null : error.getCode();
    }

    @Override
    public String toString() {
        return isSuccess() ? "Success[" + value + "]" : "Failure[" + error.getCode() + ": " + error.getMessage() + "]";
    }
}
