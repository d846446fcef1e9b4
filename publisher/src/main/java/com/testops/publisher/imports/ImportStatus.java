package com.testops.publisher.imports;

/**
 * Status of an asynchronous import job.
 *
 * Transitions reported by the server:
 *   SUBMITTED → IMPORTING → SUCCEEDED | FAILED | ERROR
 *
 * TIMEOUT is never reported by the server; the poller assigns it when its
 * deadline elapses. UNKNOWN stands for any value we do not recognise and,
 * like every status other than SUBMITTED/IMPORTING, stops polling.
 */
public enum ImportStatus {
    SUBMITTED,
    IMPORTING,
    SUCCEEDED,
    FAILED,
    ERROR,
    UNKNOWN,
    TIMEOUT;

    public boolean isTerminal() {
        return this != SUBMITTED && this != IMPORTING;
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }

    /**
     * Map the server's status string. Only the exact names of the states
     * keep polling alive; null or anything else maps to UNKNOWN, which stops it.
     */
    public static ImportStatus fromServer(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.strip()) {
            case "SUBMITTED" -> SUBMITTED;
            case "IMPORTING" -> IMPORTING;
            case "SUCCEEDED" -> SUCCEEDED;
            case "FAILED"    -> FAILED;
            case "ERROR"     -> ERROR;
            default          -> UNKNOWN;
        };
    }
}
