package com.testops.publisher.upload;

import com.testops.publisher.PublisherException;
import com.testops.publisher.retry.RetryableResult;

/**
 * Result of one upload call, and the final result of an upload sequence.
 *
 * @param kind       SUCCESS, RETRYABLE_FAILURE or FATAL_FAILURE
 * @param statusCode HTTP status; 0 when no response arrived
 * @param remoteId   id the remote system assigned (SUCCESS only)
 * @param message    response body or transport error text (failures only)
 */
public record UploadOutcome(Kind kind, int statusCode, String remoteId, String message)
        implements RetryableResult {

    public enum Kind { SUCCESS, RETRYABLE_FAILURE, FATAL_FAILURE }

    public static UploadOutcome success(int statusCode, String remoteId) {
        return new UploadOutcome(Kind.SUCCESS, statusCode, remoteId, null);
    }

    public static UploadOutcome retryable(int statusCode, String message) {
        return new UploadOutcome(Kind.RETRYABLE_FAILURE, statusCode, null, message);
    }

    public static UploadOutcome fatal(int statusCode, String message) {
        return new UploadOutcome(Kind.FATAL_FAILURE, statusCode, null, message);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public boolean isRetryable() {
        return kind == Kind.RETRYABLE_FAILURE;
    }

    /**
     * Convert a failed outcome into the exception the pipeline aborts with.
     * An exhausted retryable failure is handled exactly like a fatal one.
     */
    public PublisherException toException(String opName) {
        if (isSuccess()) {
            throw new IllegalStateException("Outcome is a success: " + this);
        }
        PublisherException.Kind errorKind = isRetryable()
                ? PublisherException.Kind.TRANSIENT
                : PublisherException.kindForStatus(statusCode);
        String text = statusCode == 0
                ? opName + " failed - " + message
                : opName + " failed - HTTP " + statusCode;
        return new PublisherException(errorKind, text, statusCode, message);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case SUCCESS           -> "SUCCESS(" + statusCode + ", id=" + remoteId + ")";
            case RETRYABLE_FAILURE -> "RETRYABLE(" + statusCode + ")";
            case FATAL_FAILURE     -> "FATAL(" + statusCode + ")";
        };
    }
}
