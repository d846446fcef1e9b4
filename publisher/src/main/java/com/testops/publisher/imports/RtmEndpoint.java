package com.testops.publisher.imports;

import com.testops.publisher.PublisherException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

/**
 * Base URL and credentials of the test-management automation API.
 *
 * Both settings are checked when first used rather than at startup, so
 * stages that never talk to the import service run without them.
 */
@Component
public class RtmEndpoint {

    private static final String API_PREFIX = "/api/v2/automation";

    private final String baseUrl;
    private final String apiToken;

    public RtmEndpoint(@Value("${publisher.rtm.base-url:}") String baseUrl,
                       @Value("${publisher.rtm.api-token:}") String apiToken) {
        this.baseUrl  = stripTrailingSlash(baseUrl);
        this.apiToken = apiToken;
    }

    public URI importUri() {
        return URI.create(requireBaseUrl() + API_PREFIX + "/import-test-results");
    }

    public URI statusUri(String taskId) {
        return URI.create(requireBaseUrl() + API_PREFIX + "/import-status/"
                + URLEncoder.encode(taskId, StandardCharsets.UTF_8));
    }

    public String authorization() {
        if (apiToken == null || apiToken.isBlank()) {
            throw new PublisherException(PublisherException.Kind.CONFIGURATION,
                    "Missing RTM_API_TOKEN environment variable");
        }
        return "Bearer " + apiToken;
    }

    private String requireBaseUrl() {
        if (baseUrl.isEmpty()) {
            throw new PublisherException(PublisherException.Kind.CONFIGURATION,
                    "Missing RTM base URL (--rtm-base or RTM_BASE_URL)");
        }
        return baseUrl;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        String s = url.strip();
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
