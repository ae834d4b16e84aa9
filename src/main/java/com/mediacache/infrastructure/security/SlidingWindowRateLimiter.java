package com.mediacache.infrastructure.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mediacache.application.exceptions.RateLimitException;
import com.mediacache.domain.model.UserContext;
import com.mediacache.infrastructure.audit.AuditEventTypes;
import com.mediacache.infrastructure.audit.AuditLogger;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Sliding-window limiter keyed by user id.
 *
 * <p>Each caller owns a deque of request timestamps, only read or changed inside an atomic
 * compute on the cache map, so expiry never races an update. Idle callers are evicted once a full
 * window has passed without a request, which bounds memory to the active user set.
 * The limiter is in-process; it does not coordinate across processes.
 */
@Slf4j
public class SlidingWindowRateLimiter implements RateLimiter {

    public static final int DEFAULT_MAX_REQUESTS = 100;
    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final AuditLogger auditLogger;
    private final Cache<String, Deque<Long>> windows;

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock, AuditLogger auditLogger) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive: " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive: " + window);
        }
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = clock;
        this.auditLogger = auditLogger;
        this.windows = Caffeine.newBuilder()
            .expireAfterAccess(windowMillis, TimeUnit.MILLISECONDS)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .maximumSize(100_000)
            .build();
    }

    @Override
    public void acquire(UserContext context, String operation) {
        String userId = context.getUserId();
        long now = clock.millis();
        boolean[] admitted = new boolean[1];
        int[] inWindow = new int[1];
        windows.asMap().compute(userId, (key, existing) -> {
            Deque<Long> timestamps = existing != null ? existing : new ArrayDeque<>();
            evictExpired(timestamps, now);
            inWindow[0] = timestamps.size();
            if (inWindow[0] < maxRequests) {
                timestamps.addLast(now);
                admitted[0] = true;
            }
            return timestamps;
        });
        if (admitted[0]) {
            return;
        }

        log.warn("Rate limit exceeded: user={}, operation={}, requests={}",
            Encode.forJava(userId), operation, inWindow[0]);
        auditLogger.failure(AuditEventTypes.RATE_LIMIT_EXCEEDED, context, operation, operation,
            Map.of("limit", maxRequests, "windowSeconds", windowMillis / 1000));
        throw new RateLimitException(
            "Rate limit exceeded: " + maxRequests + " requests per " + (windowMillis / 1000) + "s");
    }

    @Override
    public int remaining(String userId) {
        int[] used = new int[1];
        windows.asMap().computeIfPresent(userId, (key, timestamps) -> {
            evictExpired(timestamps, clock.millis());
            used[0] = timestamps.size();
            return timestamps;
        });
        return Math.max(0, maxRequests - used[0]);
    }

    private void evictExpired(Deque<Long> timestamps, long now) {
        long cutoff = now - windowMillis;
        while (!timestamps.isEmpty() && timestamps.peekFirst() <= cutoff) {
            timestamps.pollFirst();
        }
    }
}
