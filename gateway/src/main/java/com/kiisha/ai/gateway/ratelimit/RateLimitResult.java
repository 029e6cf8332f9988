package com.kiisha.ai.gateway.ratelimit;

import java.time.Duration;
import java.time.Instant;

/**
 * Result of a per-task rate limit check.
 */
public final class RateLimitResult {

    private final boolean allowed;
    private final int remainingThisMinute;
    private final int remainingThisHour;
    private final Instant resetTime;
    private final String message;

    private RateLimitResult(boolean allowed, int remainingThisMinute, int remainingThisHour,
                            Instant resetTime, String message) {
        this.allowed = allowed;
        this.remainingThisMinute = remainingThisMinute;
        this.remainingThisHour = remainingThisHour;
        this.resetTime = resetTime;
        this.message = message;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getRemainingThisMinute() {
        return remainingThisMinute;
    }

    public int getRemainingThisHour() {
        return remainingThisHour;
    }

    /**
     * When the exhausted window resets; null for allowed results.
     */
    public Instant getResetTime() {
        return resetTime;
    }

    public String getMessage() {
        return message;
    }

    public static RateLimitResult allowed(int remainingThisMinute, int remainingThisHour) {
        return new RateLimitResult(true, remainingThisMinute, remainingThisHour, null, null);
    }

    /**
     * Result for a task with no rate limit configured.
     */
    public static RateLimitResult unlimited() {
        return allowed(Integer.MAX_VALUE, Integer.MAX_VALUE);
    }

    public static RateLimitResult minuteLimitExceeded(Instant resetTime, Instant now, int remainingThisHour) {
        String message = "Rate limit exceeded: too many calls this minute. Try again in " +
                secondsBetween(now, resetTime) + " seconds.";
        return new RateLimitResult(false, 0, remainingThisHour, resetTime, message);
    }

    public static RateLimitResult hourLimitExceeded(Instant resetTime, Instant now) {
        String message = "Rate limit exceeded: too many calls this hour. Try again in " +
                secondsBetween(now, resetTime) + " seconds.";
        return new RateLimitResult(false, 0, 0, resetTime, message);
    }

    private static long secondsBetween(Instant now, Instant resetTime) {
        return Math.max(0, Duration.between(now, resetTime).getSeconds());
    }

    @Override
    public String toString() {
        return "RateLimitResult{" +
                "allowed=" + allowed +
                ", remainingThisMinute=" + remainingThisMinute +
                ", remainingThisHour=" + remainingThisHour +
                ", resetTime=" + resetTime +
                ", message='" + message + '\'' +
                '}';
    }
}
