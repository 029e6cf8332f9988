package com.kiisha.ai.gateway.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Exponential backoff settings shared by every call.
 */
public final class RetryConfig {

    private static final RetryConfig DEFAULT = new RetryConfig(3, 1000, 10000, 2.0);

    private final int maxRetries;
    private final long initialDelayMs;
    private final long maxDelayMs;
    private final double backoffMultiplier;

    @JsonCreator
    public RetryConfig(@JsonProperty("maxRetries") int maxRetries,
                       @JsonProperty("initialDelayMs") long initialDelayMs,
                       @JsonProperty("maxDelayMs") long maxDelayMs,
                       @JsonProperty("backoffMultiplier") double backoffMultiplier) {
        this.maxRetries = maxRetries;
        this.initialDelayMs = initialDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.backoffMultiplier = backoffMultiplier;
    }

    public static RetryConfig defaults() {
        return DEFAULT;
    }

    @JsonProperty("maxRetries")
    public int getMaxRetries() {
        return maxRetries;
    }

    @JsonProperty("initialDelayMs")
    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    @JsonProperty("maxDelayMs")
    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    @JsonProperty("backoffMultiplier")
    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    /**
     * Total attempts a call may make, the first one included.
     */
    @JsonIgnore
    public int getMaxAttempts() {
        return maxRetries + 1;
    }

    /**
     * Delay before retry number {@code attempt} (1-based):
     * {@code min(initialDelay * multiplier^(attempt-1), maxDelay)}.
     */
    public long delayForRetry(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        double delay = initialDelayMs * Math.pow(backoffMultiplier, attempt - 1);
        return (long) Math.min(delay, (double) maxDelayMs);
    }

    @Override
    public String toString() {
        return "RetryConfig{maxRetries=" + maxRetries +
                ", initialDelayMs=" + initialDelayMs +
                ", maxDelayMs=" + maxDelayMs +
                ", backoffMultiplier=" + backoffMultiplier + '}';
    }
}
