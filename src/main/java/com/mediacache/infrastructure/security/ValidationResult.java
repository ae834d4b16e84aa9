package com.mediacache.infrastructure.security;

import com.mediacache.application.exceptions.ValidationException;

import java.util.Objects;

/**
 * Outcome of a validator: either an accepted value or a rejection reason.
 *
 * @param <T> type of the accepted value
 */
public final class ValidationResult<T> {

    private final T value;
    private final String reason;

    private ValidationResult(T value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(Objects.requireNonNull(value), null);
    }

    public static <T> ValidationResult<T> rejected(String reason) {
        return new ValidationResult<>(null, Objects.requireNonNull(reason));
    }

    public boolean isValid() {
        return reason == null;
    }

    public T getValue() {
        if (!isValid()) {
            throw new IllegalStateException("Rejected value has no result: " + reason);
        }
        return value;
    }

    public String getReason() {
        return reason;
    }

    public T orElseThrow() {
        if (!isValid()) {
            throw new ValidationException(reason);
        }
        return value;
    }

    @Override
    public String toString() {
        return isValid() ? "Valid[" + value + "]" : "Rejected[" + reason + "]";
    }
}
