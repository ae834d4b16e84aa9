package com.mediacache.infrastructure.security;

import com.mediacache.application.exceptions.RateLimitException;
import com.mediacache.domain.model.Role;
import com.mediacache.domain.model.UserContext;
import com.mediacache.infrastructure.audit.AuditEventTypes;
import com.mediacache.infrastructure.audit.AuditLogger;
import com.mediacache.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class SlidingWindowRateLimiterTest {

    MutableClock clock;
    AuditLogger auditLogger;
    SlidingWindowRateLimiter limiter;
    UserContext bob = UserContext.of("bob", Role.USER);

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        auditLogger = mock(AuditLogger.class);
        limiter = new SlidingWindowRateLimiter(100, Duration.ofSeconds(60), clock, auditLogger);
    }

    @Test
    void hundred_and_first_request_in_window_is_rejected() {
        for (int i = 0; i < 100; i++) {
            limiter.acquire(bob, "getStatus");
        }
        assertEquals(0, limiter.remaining("bob"));

        RateLimitException e = assertThrows(RateLimitException.class, () -> limiter.acquire(bob, "getStatus"));

        assertEquals("Rate limit exceeded: 100 requests per 60s", e.getMessage());
        verify(auditLogger).failure(eq(AuditEventTypes.RATE_LIMIT_EXCEEDED), eq(bob), eq("getStatus"),
            eq("getStatus"), anyMap());
    }

    @Test
    void window_slides() {
        for (int i = 0; i < 100; i++) {
            limiter.acquire(bob, "getStatus");
            clock.advance(Duration.ofMillis(100));
        }
        assertThrows(RateLimitException.class, () -> limiter.acquire(bob, "getStatus"));

        // first request was at t=0, now is t=10s; it leaves the window at t=60s
        clock.advance(Duration.ofSeconds(50));
        limiter.acquire(bob, "getStatus");
        assertThrows(RateLimitException.class, () -> limiter.acquire(bob, "getStatus"));
    }

    @Test
    void rejected_requests_do_not_count() {
        for (int i = 0; i < 100; i++) {
            limiter.acquire(bob, "getStatus");
        }
        for (int i = 0; i < 5; i++) {
            assertThrows(RateLimitException.class, () -> limiter.acquire(bob, "getStatus"));
        }
        clock.advance(Duration.ofSeconds(61));

        assertEquals(100, limiter.remaining("bob"));
        verify(auditLogger, times(5)).failure(eq(AuditEventTypes.RATE_LIMIT_EXCEEDED), eq(bob), eq("getStatus"),
            eq("getStatus"), anyMap());
    }

    @Test
    void users_are_limited_independently() {
        for (int i = 0; i < 100; i++) {
            limiter.acquire(bob, "getStatus");
        }

        limiter.acquire(UserContext.of("carol", Role.USER), "getStatus");
        assertEquals(99, limiter.remaining("carol"));
    }

    @Test
    void concurrent_callers_never_exceed_the_limit() throws Exception {
        AtomicInteger accepted = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    try {
                        limiter.acquire(bob, "getStatus");
                        accepted.incrementAndGet();
                    } catch (RateLimitException e) {
                        // expected past the limit
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, accepted.get());
    }

    @Test
    void expired_window_is_replaced_once_under_contention() throws Exception {
        for (int i = 0; i < 100; i++) {
            limiter.acquire(bob, "getStatus");
        }
        clock.advance(Duration.ofSeconds(61));

        AtomicInteger accepted = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                futures.add(pool.submit(() -> {
                    try {
                        limiter.acquire(bob, "getStatus");
                        accepted.incrementAndGet();
                    } catch (RateLimitException e) {
                        // expected past the limit
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(100, accepted.get());
        assertEquals(0, limiter.remaining("bob"));
    }

    @Test
    void remaining_for_unknown_user_is_the_full_quota() {
        assertEquals(100, limiter.remaining("nobody"));
    }

    @Test
    void rejects_nonsensical_configuration() {
        assertThrows(IllegalArgumentException.class,
            () -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60), clock, auditLogger));
        assertThrows(IllegalArgumentException.class,
            () -> new SlidingWindowRateLimiter(10, Duration.ZERO, clock, auditLogger));
    }
}
