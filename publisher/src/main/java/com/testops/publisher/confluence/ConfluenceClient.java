package com.testops.publisher.confluence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testops.publisher.PublisherException;
import com.testops.publisher.upload.AuthHeaders;
import com.testops.publisher.upload.UploadTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Wiki (Confluence REST) calls for publishing a report page.
 *
 * Flow used by the pipeline:
 *   createPage → upload attachments (upload engine) → pageVersion → updatePage
 */
@Component
public class ConfluenceClient {

    private static final Logger log = LoggerFactory.getLogger(ConfluenceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       user;
    private final String       apiToken;
    private final String       spaceKey;

    public ConfluenceClient(HttpClient http,
                            ObjectMapper objectMapper,
                            @Value("${publisher.confluence.base-url:}") String baseUrl,
                            @Value("${publisher.confluence.user:}") String user,
                            @Value("${publisher.confluence.api-token:}") String apiToken,
                            @Value("${publisher.confluence.space:}") String spaceKey) {
        this.http     = http;
        this.json     = objectMapper;
        this.baseUrl  = baseUrl == null ? "" : baseUrl.strip().replaceAll("/+$", "");
        this.user     = user;
        this.apiToken = apiToken;
        this.spaceKey = spaceKey;
    }

    /**
     * Check every setting this client needs.
     *
     * @throws PublisherException CONFIGURATION naming the missing variable
     */
    public void requireConfigured() {
        if (baseUrl.isEmpty())                       throw missing("CONFLUENCE_BASE");
        if (user == null || user.isBlank())          throw missing("CONFLUENCE_USER");
        if (apiToken == null || apiToken.isBlank())  throw missing("CONFLUENCE_TOKEN");
        if (spaceKey == null || spaceKey.isBlank())  throw missing("CONFLUENCE_SPACE");
        if (baseUrl.contains("/rest/api")) {
            throw new PublisherException(PublisherException.Kind.CONFIGURATION,
                    "CONFLUENCE_BASE must not contain '/rest/api'; use e.g. https://company.atlassian.net/wiki");
        }
    }

    /** @return id of the new page */
    public String createPage(String title, String storageHtml) {
        requireConfigured();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type",  "page");
        payload.put("title", title);
        payload.put("space", Map.of("key", spaceKey));
        payload.put("body",  storageBody(storageHtml));

        log.info("Creating page '{}' in space {}", title, spaceKey);
        String respBody = send("POST", "/rest/api/content", toJson(payload), "createPage");
        String id = field(respBody, "id", "createPage");
        log.info("Created page {}", id);
        return id;
    }

    /** Current version number of the page; an update must send this plus one. */
    public int pageVersion(String pageId) {
        requireConfigured();
        String respBody = send("GET", "/rest/api/content/" + pageId + "?expand=version", null, "pageVersion");
        try {
            JsonNode number = json.readTree(respBody).path("version").path("number");
            if (!number.canConvertToInt()) {
                throw new PublisherException(PublisherException.Kind.PROTOCOL,
                        "Page " + pageId + " response has no version number", 0, respBody);
            }
            return number.asInt();
        } catch (JsonProcessingException e) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Unreadable page version response", 0, respBody);
        }
    }

    public void updatePage(String pageId, String title, String storageHtml, int newVersion) {
        requireConfigured();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id",      pageId);
        payload.put("type",    "page");
        payload.put("title",   title);
        payload.put("version", Map.of("number", newVersion));
        payload.put("body",    storageBody(storageHtml));

        send("PUT", "/rest/api/content/" + pageId, toJson(payload), "updatePage");
        log.info("Updated page {} to version {}", pageId, newVersion);
    }

    /** Upload target for attaching {@code file} to the page; duplicates allowed. */
    public UploadTarget attachmentTarget(String pageId, Path file) {
        requireConfigured();
        return new UploadTarget(
                URI.create(baseUrl + "/rest/api/content/" + pageId + "/child/attachment?allowDuplicated=true"),
                file,
                UploadTarget.contentTypeFor(file),
                Set.of(200, 201),
                AuthHeaders.basic(user, apiToken));
    }

    public String pageUrl(String pageId) {
        return baseUrl + "/spaces/" + spaceKey + "/pages/" + pageId;
    }

    public String downloadLink(String pageId, String fileName) {
        return baseUrl + "/download/attachments/" + pageId + "/"
                + URLEncoder.encode(fileName, StandardCharsets.UTF_8).replace("+", "%20");
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static Map<String, Object> storageBody(String html) {
        return Map.of("storage", Map.of("value", html, "representation", "storage"));
    }

    private static PublisherException missing(String variable) {
        return new PublisherException(PublisherException.Kind.CONFIGURATION,
                "Missing required environment variable: " + variable);
    }

    private String send(String method, String path, String jsonBody, String opName) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(60))
                .header("Accept",            "application/json")
                .header("X-Atlassian-Token", "no-check")
                .header("Authorization",     AuthHeaders.basic(user, apiToken));
        if (jsonBody == null) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/json")
                   .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        }
        try {
            HttpResponse<String> resp = http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
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

    private String field(String body, String name, String opName) {
        try {
            JsonNode node = json.readTree(body).get(name);
            if (node == null || node.asText().isBlank()) {
                throw new PublisherException(PublisherException.Kind.PROTOCOL,
                        opName + " response has no '" + name + "'", 0, body);
            }
            return node.asText();
        } catch (JsonProcessingException e) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Unreadable " + opName + " response", 0, body);
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
