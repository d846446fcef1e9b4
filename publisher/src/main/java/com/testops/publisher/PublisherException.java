package com.testops.publisher;

/**
 * Thrown when a publishing stage cannot complete.
 *
 * Unchecked so the clients and the pipeline stay free of throws clauses;
 * {@link com.testops.publisher.cli.StageRunner} is the single place that
 * catches it, reports it and turns it into exit code 1.
 */
public class PublisherException extends RuntimeException {

    public enum Kind {
        /** A local input file is missing or unreadable. Never retried. */
        LOCAL_IO,
        /** 401 / 403. */
        AUTH,
        /** 404. */
        NOT_FOUND,
        /** 413. */
        PAYLOAD_TOO_LARGE,
        /** 408 / 429 / 5xx or a transport failure, after the retry budget ran out. */
        TRANSIENT,
        /** The response had a shape we could not interpret. */
        PROTOCOL,
        /** A status outside every known class. */
        UNEXPECTED_STATUS,
        /** The import job reported FAILED or ERROR. */
        JOB_FAILED,
        /** The client-side poll deadline elapsed. */
        TIMEOUT,
        /** A wait was cancelled (JVM shutdown) or the thread was interrupted. */
        CANCELLED,
        /** A required setting or environment variable is missing or invalid. */
        CONFIGURATION
    }

    private final Kind   kind;
    private final int    statusCode;
    private final String responseBody;

    public PublisherException(Kind kind, String message) {
        this(kind, message, 0, null, null);
    }

    public PublisherException(Kind kind, String message, Throwable cause) {
        this(kind, message, 0, null, cause);
    }

    public PublisherException(Kind kind, String message, int statusCode, String responseBody) {
        this(kind, message, statusCode, responseBody, null);
    }

    private PublisherException(Kind kind, String message, int statusCode,
                               String responseBody, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind         = kind;
        this.statusCode   = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * Map an HTTP status that was not accepted to the matching kind.
     * Status 0 stands for "no response" (transport failure).
     */
    public static Kind kindForStatus(int statusCode) {
        return switch (statusCode) {
            case 401, 403 -> Kind.AUTH;
            case 404      -> Kind.NOT_FOUND;
            case 413      -> Kind.PAYLOAD_TOO_LARGE;
            case 0, 408, 429, 500, 502, 503, 504 -> Kind.TRANSIENT;
            default       -> Kind.UNEXPECTED_STATUS;
        };
    }

    /** Build an exception for a rejected HTTP response. */
    public static PublisherException forResponse(String opName, int statusCode, String body) {
        return new PublisherException(kindForStatus(statusCode),
                opName + " failed - HTTP " + statusCode, statusCode, body);
    }

    public Kind getKind()           { return kind; }
    public int getStatusCode()      { return statusCode; }
    public String getResponseBody() { return responseBody; }
}
