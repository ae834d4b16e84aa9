package com.mediacache.infrastructure.filesystem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeoutException;

/**
 * Point in time after which a long-running filesystem step gives up.
 */
public final class Deadline {

    private final Clock clock;
    private final Instant expiresAt;

    private Deadline(Clock clock, Instant expiresAt) {
        this.clock = clock;
        this.expiresAt = expiresAt;
    }

    public static Deadline after(Duration timeout, Clock clock) {
        return new Deadline(clock, Instant.now(clock).plus(timeout));
    }

    public static Deadline none() {
        return new Deadline(Clock.systemUTC(), Instant.MAX);
    }

    public boolean isExpired() {
        return !Instant.now(clock).isBefore(expiresAt);
    }

    public Duration remaining() {
        if (expiresAt.equals(Instant.MAX)) {
            return Duration.ofMillis(Long.MAX_VALUE);
        }
        Duration left = Duration.between(Instant.now(clock), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void check(String step) throws TimeoutException {
        if (isExpired()) {
            throw new TimeoutException("Deadline exceeded during " + step);
        }
    }
}
