package com.mediacache.infrastructure.security;

import com.mediacache.domain.model.UserContext;

/**
 * Per-caller request quota.
 */
public interface RateLimiter {

    /**
     * Consume one unit of the caller's quota.
     *
     * @param context caller
     * @param operation operation name, used for audit only
     * @throws com.mediacache.application.exceptions.RateLimitException when the quota is spent
     */
    void acquire(UserContext context, String operation);

    /**
     * Units left in the caller's current window.
     */
    int remaining(String userId);
}
