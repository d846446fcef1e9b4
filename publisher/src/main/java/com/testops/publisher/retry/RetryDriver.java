package com.testops.publisher.retry;

import com.testops.publisher.PublisherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Generic bounded retry loop.
 *
 * Calls the attempt up to {@code maxAttempts} times. A non-retryable result
 * ends the loop at once; a retryable one is followed by a backoff wait,
 * except after the final attempt, whose result is returned as is. The
 * attempt itself decides what is retryable (see {@link StatusClassifier}),
 * so this class never looks at status codes.
 */
public class RetryDriver {

    private static final Logger log = LoggerFactory.getLogger(RetryDriver.class);

    /** One attempt; receives its 1-based number. */
    @FunctionalInterface
    public interface Attempt<R extends RetryableResult> {
        R call(int attemptNumber);
    }

    private final BackoffPolicy backoff;
    private final Sleeper       sleeper;

    public RetryDriver(BackoffPolicy backoff, Sleeper sleeper) {
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public <R extends RetryableResult> R run(String opName, int maxAttempts, Attempt<R> attempt) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        R result = null;
        for (int n = 1; n <= maxAttempts; n++) {
            result = attempt.call(n);
            if (!result.isRetryable()) {
                return result;
            }
            if (n == maxAttempts) {
                break;
            }
            Duration delay = backoff.delayForAttempt(n);
            log.warn("{}: attempt {}/{} failed ({}), retrying in {} ms",
                    opName, n, maxAttempts, result, delay.toMillis());
            pause(opName, delay);
        }
        log.error("{}: giving up after {} attempts", opName, maxAttempts);
        return result;
    }

    public BackoffPolicy backoff() {
        return backoff;
    }

    private void pause(String opName, Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    opName + " interrupted while backing off", e);
        } catch (CancellationException e) {
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    opName + " cancelled while backing off", e);
        }
    }
}
