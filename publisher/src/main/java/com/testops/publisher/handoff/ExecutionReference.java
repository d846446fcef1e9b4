package com.testops.publisher.handoff;

import com.testops.publisher.PublisherException;

import java.util.regex.Pattern;

/**
 * Key of a test-execution record, passed between independently invoked stages.
 *
 * @param key          issue-style key, e.g. {@code RT-1234}
 * @param sourceSystem where the key came from
 */
public record ExecutionReference(String key, SourceSystem sourceSystem) {

    public static final Pattern KEY_PATTERN = Pattern.compile("^[A-Z]{1,10}-\\d+$");

    /**
     * @throws PublisherException PROTOCOL if the key does not look like an issue key
     */
    public ExecutionReference {
        key = key == null ? "" : key.strip();
        if (!KEY_PATTERN.matcher(key).matches()) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Invalid execution key format: '" + key + "'");
        }
    }

    public static boolean isValidKey(String key) {
        return key != null && KEY_PATTERN.matcher(key.strip()).matches();
    }
}
