package com.testops.publisher.retry;

/** A per-attempt result that tells the {@link RetryDriver} whether to try again. */
public interface RetryableResult {

    boolean isRetryable();
}
