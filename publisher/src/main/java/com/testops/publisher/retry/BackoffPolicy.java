package com.testops.publisher.retry;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Explicit backoff schedule for retry attempts.
 *
 * Attempt n waits {@code schedule[min(n-1, len-1)]}: the wait grows through
 * the listed values and then holds at the last one. There is no jitter.
 */
public final class BackoffPolicy {

    private final List<Duration> schedule;

    public BackoffPolicy(List<Duration> schedule) {
        if (schedule == null || schedule.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule must not be empty");
        }
        for (Duration d : schedule) {
            if (d == null || d.isNegative()) {
                throw new IllegalArgumentException("Backoff delays must be non-negative: " + schedule);
            }
        }
        this.schedule = List.copyOf(schedule);
    }

    /** Convenience factory, e.g. {@code BackoffPolicy.ofSeconds(2, 4, 6)}. */
    public static BackoffPolicy ofSeconds(long... seconds) {
        return new BackoffPolicy(Arrays.stream(seconds).mapToObj(Duration::ofSeconds).toList());
    }

    /** Delay to apply after the given (1-based) attempt failed. */
    public Duration delayForAttempt(int attempt) {
        return delayForAttempt(attempt, schedule);
    }

    public static Duration delayForAttempt(int attempt, List<Duration> scheme) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1, got " + attempt);
        }
        if (scheme.isEmpty()) {
            throw new IllegalArgumentException("Backoff schedule must not be empty");
        }
        return scheme.get(Math.min(attempt - 1, scheme.size() - 1));
    }

    public List<Duration> schedule() {
        return schedule;
    }

    @Override
    public String toString() {
        return "BackoffPolicy" + schedule;
    }
}
