package com.testops.publisher.retry;

import java.util.Set;

/**
 * Pure status-code policy shared by every retrying call.
 *
 * <ul>
 *   <li>codes in the success set: {@link ResponseClass#SUCCESS}</li>
 *   <li>401, 403, 404, 413: {@link ResponseClass#FATAL}; waiting cannot fix them</li>
 *   <li>408, 429, 500, 502, 503, 504: {@link ResponseClass#RETRYABLE}</li>
 *   <li>anything else: {@link ResponseClass#FATAL}</li>
 * </ul>
 *
 * The success set is checked first, so a target that expects 204 gets it
 * classified as success even though it is not in the default set.
 */
public final class StatusClassifier {

    public static final Set<Integer> DEFAULT_SUCCESS = Set.of(200, 201);

    private static final Set<Integer> NEVER_RETRY = Set.of(401, 403, 404, 413);
    private static final Set<Integer> RETRY       = Set.of(408, 429, 500, 502, 503, 504);

    private StatusClassifier() {}

    public static ResponseClass classify(int statusCode) {
        return classify(statusCode, DEFAULT_SUCCESS);
    }

    public static ResponseClass classify(int statusCode, Set<Integer> successCodes) {
        if (successCodes.contains(statusCode)) {
            return ResponseClass.SUCCESS;
        }
        if (NEVER_RETRY.contains(statusCode)) {
            return ResponseClass.FATAL;
        }
        if (RETRY.contains(statusCode)) {
            return ResponseClass.RETRYABLE;
        }
        return ResponseClass.FATAL;
    }

    /** True for the statuses that are retried when they show up. */
    public static boolean isRetryableStatus(int statusCode) {
        return RETRY.contains(statusCode);
    }
}
