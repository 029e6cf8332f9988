package com.kiisha.ai.gateway.routing;

/**
 * Blocking pause used between retries; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
