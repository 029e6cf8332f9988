package com.kiisha.ai.gateway.routing;

/**
 * Notified before each retry with the 1-based retry number and the failure that caused it.
 */
@FunctionalInterface
public interface RetryObserver {

    RetryObserver NONE = (attempt, error) -> { };

    void onRetry(int attempt, Exception error);
}
