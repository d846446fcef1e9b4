package com.testops.publisher.jira;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testops.publisher.PublisherException;
import com.testops.publisher.handoff.ExecutionReference;
import com.testops.publisher.handoff.SourceSystem;
import com.testops.publisher.upload.AuthHeaders;
import com.testops.publisher.upload.UploadTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Issue-tracker (Jira REST v3) calls used by the pipeline.
 *
 * Issue creation is a single call; attachment uploads are only described
 * here ({@link #attachmentTarget}) and executed by the upload engine.
 */
@Component
public class JiraClient {

    private static final Logger log = LoggerFactory.getLogger(JiraClient.class);

    public static final String TEST_EXECUTION_ISSUE_TYPE = "Test Execution";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       user;
    private final String       apiToken;

    public JiraClient(HttpClient http,
                      ObjectMapper objectMapper,
                      @Value("${publisher.jira.base-url:}") String baseUrl,
                      @Value("${publisher.jira.user:}") String user,
                      @Value("${publisher.jira.api-token:}") String apiToken) {
        this.http     = http;
        this.json     = objectMapper;
        this.baseUrl  = baseUrl == null ? "" : baseUrl.strip().replaceAll("/+$", "");
        this.user     = user;
        this.apiToken = apiToken;
    }

    /**
     * Create a "Test Execution" issue.
     *
     * @return reference to the created issue
     * @throws PublisherException with the status-derived kind on rejection,
     *         PROTOCOL if the response carries no issue key
     */
    public ExecutionReference createTestExecution(String projectKey, String summary, String description) {
        requireConfigured();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("project",     Map.of("key", projectKey));
        fields.put("summary",     summary);
        fields.put("description", description);
        fields.put("issuetype",   Map.of("name", TEST_EXECUTION_ISSUE_TYPE));

        log.info("Creating {} in project {}: {}", TEST_EXECUTION_ISSUE_TYPE, projectKey, summary);
        String respBody = postJson("/rest/api/3/issue", toJson(Map.of("fields", fields)),
                "createTestExecution in " + projectKey);

        String key;
        try {
            JsonNode node = json.readTree(respBody).get("key");
            key = node == null ? null : node.asText();
        } catch (JsonProcessingException e) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Unreadable issue creation response", 0, respBody);
        }
        if (key == null || key.isBlank()) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Issue created but no key in response", 0, respBody);
        }
        log.info("Created {} {}", TEST_EXECUTION_ISSUE_TYPE, key);
        return new ExecutionReference(key, SourceSystem.ISSUE_TRACKER);
    }

    /** Upload target for attaching {@code file} to the given issue. */
    public UploadTarget attachmentTarget(ExecutionReference issue, Path file) {
        requireConfigured();
        return new UploadTarget(
                URI.create(baseUrl + "/rest/api/3/issue/" + issue.key() + "/attachments"),
                file,
                UploadTarget.contentTypeFor(file),
                Set.of(200, 201),
                AuthHeaders.basic(user, apiToken));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private void requireConfigured() {
        if (baseUrl.isEmpty())                       throw missing("JIRA_URL");
        if (user == null || user.isBlank())          throw missing("JIRA_USER");
        if (apiToken == null || apiToken.isBlank())  throw missing("JIRA_API_TOKEN");
    }

    private static PublisherException missing(String variable) {
        return new PublisherException(PublisherException.Kind.CONFIGURATION,
                "Missing required environment variable: " + variable);
    }

    private String postJson(String path, String body, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(60))
                .header("Content-Type",  "application/json")
                .header("Accept",        "application/json")
                .header("Authorization", AuthHeaders.basic(user, apiToken))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() != 200 && resp.statusCode() != 201) {
                throw PublisherException.forResponse(opName, resp.statusCode(), resp.body());
            }
            return resp.body();
        } catch (IOException e) {
            throw new PublisherException(PublisherException.Kind.TRANSIENT, opName + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED, opName + " interrupted", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL, "JSON serialization failed", e);
        }
    }
}
