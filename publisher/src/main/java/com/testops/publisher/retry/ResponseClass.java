package com.testops.publisher.retry;

/** Outcome class of a single HTTP response, as far as retrying is concerned. */
public enum ResponseClass {
    SUCCESS,
    RETRYABLE,
    FATAL
}
