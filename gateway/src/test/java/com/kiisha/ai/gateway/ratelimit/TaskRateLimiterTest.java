package com.kiisha.ai.gateway.ratelimit;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.common.model.Role;
import com.kiisha.ai.gateway.MutableClock;
import com.kiisha.ai.gateway.policy.TaskPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaskRateLimiter.
 */
class TaskRateLimiterTest {

    private MutableClock clock;
    private TaskRateLimiter rateLimiter;
    private TaskPolicy policy;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2025-03-10T09:00:00Z");
        rateLimiter = new TaskRateLimiter(clock);
        policy = TaskPolicy.builder(AiTask.GEO_PARSE)
                .allow(Role.ADMIN)
                .rateLimit(3, 5)
                .build();
    }

    // ========== Basic Rate Limiting Tests ==========

    @Test
    void testTryAcquire_allowedCall() {
        RateLimitResult result = rateLimiter.tryAcquire("user-1", policy);
        assertTrue(result.isAllowed());
        assertEquals(2, result.getRemainingThisMinute());
        assertEquals(4, result.getRemainingThisHour());
    }

    @Test
    void testTryAcquire_noRateLimitConfigured() {
        TaskPolicy open = TaskPolicy.builder(AiTask.GEO_PARSE).allow(Role.ADMIN).build();
        for (int i = 0; i < 100; i++) {
            assertTrue(rateLimiter.tryAcquire("user-1", open).isAllowed());
        }
        assertEquals(0, rateLimiter.trackedCallers());
    }

    @Test
    void testTryAcquire_separateCountersPerUser() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("user-1", policy);
        }
        assertFalse(rateLimiter.tryAcquire("user-1", policy).isAllowed());
        assertTrue(rateLimiter.tryAcquire("user-2", policy).isAllowed());
    }

    @Test
    void testTryAcquire_separateCountersPerTask() {
        TaskPolicy other = TaskPolicy.builder(AiTask.OCR_EXTRACT).allow(Role.ADMIN).rateLimit(3, 5).build();
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("user-1", policy);
        }
        assertTrue(rateLimiter.tryAcquire("user-1", other).isAllowed());
    }

    // ========== Window Tests ==========

    @Test
    void testTryAcquire_minuteLimitExceeded() {
        for (int i = 0; i < 3; i++) {
            assertTrue(rateLimiter.tryAcquire("user-1", policy).isAllowed());
        }

        RateLimitResult denied = rateLimiter.tryAcquire("user-1", policy);
        assertFalse(denied.isAllowed());
        assertEquals(0, denied.getRemainingThisMinute());
        assertEquals(2, denied.getRemainingThisHour());
        assertTrue(denied.getMessage().contains("this minute"));
        assertEquals(clock.instant().plusSeconds(60), denied.getResetTime());
    }

    @Test
    void testTryAcquire_minuteWindowResets() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("user-1", policy);
        }
        clock.advance(Duration.ofSeconds(61));

        assertTrue(rateLimiter.tryAcquire("user-1", policy).isAllowed());
    }

    @Test
    void testTryAcquire_hourLimitExceeded() {
        for (int i = 0; i < 5; i++) {
            assertTrue(rateLimiter.tryAcquire("user-1", policy).isAllowed(), "call " + i);
            clock.advance(Duration.ofMinutes(2));
        }

        RateLimitResult denied = rateLimiter.tryAcquire("user-1", policy);
        assertFalse(denied.isAllowed());
        assertTrue(denied.getMessage().contains("this hour"));

        clock.advance(Duration.ofMinutes(51));
        assertTrue(rateLimiter.tryAcquire("user-1", policy).isAllowed());
    }

    @Test
    void testDeniedCallsAreNotCounted() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("user-1", policy);
        }
        rateLimiter.tryAcquire("user-1", policy);
        rateLimiter.tryAcquire("user-1", policy);
        clock.advance(Duration.ofSeconds(61));

        RateLimitResult result = rateLimiter.tryAcquire("user-1", policy);
        assertTrue(result.isAllowed());
        assertEquals(1, result.getRemainingThisHour());
    }

    // ========== Cleanup Tests ==========

    @Test
    void testCleanupIdle() {
        rateLimiter.tryAcquire("user-1", policy);
        clock.advance(Duration.ofMinutes(30));
        rateLimiter.tryAcquire("user-2", policy);
        clock.advance(Duration.ofMinutes(31));

        assertEquals(1, rateLimiter.cleanupIdle());
        assertEquals(1, rateLimiter.trackedCallers());
    }

    @Test
    void testCleanupIdle_concurrentCallsAreNeverLost() throws Exception {
        TaskPolicy roomy = TaskPolicy.builder(AiTask.GEO_PARSE)
                .allow(Role.ADMIN)
                .rateLimit(1000, 1000)
                .build();
        rateLimiter.tryAcquire("user-1", roomy);
        clock.advance(Duration.ofMinutes(61));

        AtomicBoolean done = new AtomicBoolean();
        Thread sweeper = new Thread(() -> {
            while (!done.get()) {
                rateLimiter.cleanupIdle();
            }
        });
        sweeper.start();

        ExecutorService callers = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(callers.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        assertTrue(rateLimiter.tryAcquire("user-1", roomy).isAllowed());
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            done.set(true);
            sweeper.join(5000);
            callers.shutdownNow();
        }

        assertEquals(599, rateLimiter.tryAcquire("user-1", roomy).getRemainingThisHour());
    }
}
