package com.testops.publisher.retry;

import java.time.Duration;

/**
 * Blocking wait used between retry attempts and poll ticks.
 *
 * Injected everywhere a component waits so tests can record the requested
 * delays instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Wait for the given duration.
     *
     * @throws InterruptedException if the calling thread is interrupted
     * @throws java.util.concurrent.CancellationException if the wait was cancelled
     */
    void sleep(Duration duration) throws InterruptedException;
}
