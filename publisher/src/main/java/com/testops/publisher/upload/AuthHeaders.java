package com.testops.publisher.upload;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** Authorization header values for the target systems. */
public final class AuthHeaders {

    private AuthHeaders() {}

    public static String basic(String user, String token) {
        String raw = user + ":" + token;
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }
}
