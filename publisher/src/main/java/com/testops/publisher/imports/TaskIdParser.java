package com.testops.publisher.imports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testops.publisher.PublisherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads the task id from an import submission response.
 *
 * The service answers either with the bare id ({@code 8f1c...}) or with a
 * JSON document carrying it. Structured decoding is tried first; a body
 * that starts like JSON but does not parse falls back to the bare form and
 * is logged at WARN, since that usually means the service changed its
 * response format.
 */
@Component
public class TaskIdParser {

    private static final Logger log = LoggerFactory.getLogger(TaskIdParser.class);

    // Checked in this order; the first non-blank one wins.
    private static final List<String> ID_FIELDS = List.of("taskId", "id", "jobId", "key");

    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private final ObjectMapper json;

    public TaskIdParser(ObjectMapper json) {
        this.json = json;
    }

    /**
     * @throws PublisherException with kind PROTOCOL if no usable id is found
     */
    public ParsedTaskId parse(String body) {
        String trimmed = body == null ? "" : body.strip();
        if (trimmed.isEmpty()) {
            throw protocolError("empty response body", body);
        }

        if (looksLikeJson(trimmed)) {
            JsonNode root;
            try {
                root = json.readTree(trimmed);
            } catch (JsonProcessingException e) {
                log.warn("Import response looks like JSON but does not parse ({}); "
                        + "treating the whole body as a bare task id", e.getOriginalMessage());
                return plain(trimmed, body);
            }
            if (root.isTextual()) {
                // a JSON string literal: "abc-123"
                return plain(root.asText().strip(), body);
            }
            if (root.isObject()) {
                for (String field : ID_FIELDS) {
                    JsonNode node = root.get(field);
                    if (node != null && node.isValueNode() && !node.asText().isBlank()) {
                        return ParsedTaskId.fromJsonField(node.asText().strip());
                    }
                }
                throw protocolError("JSON response has none of the fields " + ID_FIELDS, body);
            }
            throw protocolError("unexpected JSON " + root.getNodeType(), body);
        }
        return plain(trimmed, body);
    }

    private static ParsedTaskId plain(String candidate, String body) {
        if (candidate.isEmpty() || WHITESPACE.matcher(candidate).find()) {
            throw protocolError("response is not a task id", body);
        }
        return ParsedTaskId.plain(candidate);
    }

    private static boolean looksLikeJson(String s) {
        char c = s.charAt(0);
        return c == '{' || c == '[' || c == '"';
    }

    private static PublisherException protocolError(String reason, String body) {
        return new PublisherException(PublisherException.Kind.PROTOCOL,
                "Could not read task id from import response: " + reason, 0, body);
    }
}
