package com.testops.publisher.imports;

/**
 * Task id read from an import submission response, tagged with where it came from.
 *
 * @param source  PLAIN when the body was the bare id, JSON_FIELD when it was
 *                read from a field of a JSON object
 * @param taskId  non-empty identifier
 */
public record ParsedTaskId(Source source, String taskId) {

    public enum Source { PLAIN, JSON_FIELD }

    public static ParsedTaskId plain(String taskId) {
        return new ParsedTaskId(Source.PLAIN, taskId);
    }

    public static ParsedTaskId fromJsonField(String taskId) {
        return new ParsedTaskId(Source.JSON_FIELD, taskId);
    }
}
