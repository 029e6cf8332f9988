package com.kiisha.ai.gateway.ratelimit;

import com.kiisha.ai.common.model.AiTask;
import com.kiisha.ai.gateway.policy.TaskPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-caller, per-task call counters enforcing a policy's minute and hour ceilings.
 * Uses fixed windows; a call is counted only when both windows have room.
 */
public class TaskRateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(TaskRateLimiter.class);

    private static final Duration MINUTE = Duration.ofMinutes(1);
    private static final Duration HOUR = Duration.ofHours(1);

    private final Map<String, CallWindows> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public TaskRateLimiter(Clock clock) {
        this.clock = clock;
        logger.info("TaskRateLimiter initialized");
    }

    /**
     * Checks the policy's rate limit for this caller and, if allowed, counts the call.
     */
    public RateLimitResult tryAcquire(String userId, TaskPolicy policy) {
        if (policy.getRateLimit().isEmpty()) {
            return RateLimitResult.unlimited();
        }
        TaskPolicy.RateLimit limit = policy.getRateLimit().get();
        Instant now = clock.instant();
        RateLimitResult[] result = new RateLimitResult[1];
        windows.compute(key(userId, policy.getTask()), (k, w) -> {
            CallWindows callWindows = w != null ? w : new CallWindows(now);
            result[0] = callWindows.tryAcquire(limit, now);
            return callWindows;
        });
        if (!result[0].isAllowed()) {
            logger.debug("Rate limit hit for user {} on {}: {}", userId, policy.getTask(), result[0].getMessage());
        }
        return result[0];
    }

    /**
     * Drops counters idle for longer than an hour.
     */
    public int cleanupIdle() {
        Instant threshold = clock.instant().minus(HOUR);
        int removed = 0;
        for (String key : windows.keySet()) {
            // Same per-key lock as tryAcquire
            boolean[] dropped = new boolean[1];
            windows.computeIfPresent(key, (k, w) -> {
                if (w.isIdleSince(threshold)) {
                    dropped[0] = true;
                    return null;
                }
                return w;
            });
            if (dropped[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Removed {} idle rate limit windows", removed);
        }
        return removed;
    }

    int trackedCallers() {
        return windows.size();
    }

    private static String key(String userId, AiTask task) {
        return userId + ":" + task.name();
    }

    private static class CallWindows {
        private Instant minuteStart;
        private Instant hourStart;
        private int minuteCount;
        private int hourCount;
        private volatile Instant lastAccess;

        CallWindows(Instant now) {
            this.minuteStart = now;
            this.hourStart = now;
            this.lastAccess = now;
        }

        synchronized RateLimitResult tryAcquire(TaskPolicy.RateLimit limit, Instant now) {
            lastAccess = now;
            if (!now.isBefore(minuteStart.plus(MINUTE))) {
                minuteStart = now;
                minuteCount = 0;
            }
            if (!now.isBefore(hourStart.plus(HOUR))) {
                hourStart = now;
                hourCount = 0;
            }

            if (hourCount >= limit.getPerHour()) {
                return RateLimitResult.hourLimitExceeded(hourStart.plus(HOUR), now);
            }
            if (minuteCount >= limit.getPerMinute()) {
                return RateLimitResult.minuteLimitExceeded(minuteStart.plus(MINUTE), now,
                        limit.getPerHour() - hourCount);
            }

            minuteCount++;
            hourCount++;
            return RateLimitResult.allowed(limit.getPerMinute() - minuteCount, limit.getPerHour() - hourCount);
        }

        boolean isIdleSince(Instant threshold) {
            return lastAccess.isBefore(threshold);
        }
    }
}
