package com.testops.publisher.upload;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testops.publisher.PublisherException;
import com.testops.publisher.retry.BackoffPolicy;
import com.testops.publisher.retry.ResponseClass;
import com.testops.publisher.retry.RetryDriver;
import com.testops.publisher.retry.Sleeper;
import com.testops.publisher.retry.StatusClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.time.Duration;

/**
 * Uploads one local file to an attachment endpoint, retrying transient failures.
 *
 * Every attempt is a single multipart POST with the form field {@code file}
 * and {@code X-Atlassian-Token: no-check} (the wiki and issue tracker reject
 * attachment uploads without it). The response status is classified by
 * {@link StatusClassifier}; the loop itself is {@link RetryDriver}.
 *
 * Uploads are not idempotent: when a response is lost after the server
 * stored the file, the retry stores it again. Both target systems accept
 * duplicate attachments, so this is tolerated rather than prevented.
 */
@Component
public class UploadRetryEngine {

    private static final Logger log = LoggerFactory.getLogger(UploadRetryEngine.class);

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final Sleeper       sleeper;
    private final MeterRegistry meterRegistry;
    private final Duration      requestTimeout;
    private final BackoffPolicy defaultBackoff;

    public UploadRetryEngine(HttpClient http,
                             ObjectMapper objectMapper,
                             Sleeper sleeper,
                             MeterRegistry meterRegistry,
                             @Value("${publisher.upload.timeout-seconds:60}") long timeoutSeconds,
                             @Value("${publisher.upload.backoff-seconds:2,4,6}") long[] backoffSeconds) {
        this.http           = http;
        this.json           = objectMapper;
        this.sleeper        = sleeper;
        this.meterRegistry  = meterRegistry;
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
        this.defaultBackoff = BackoffPolicy.ofSeconds(backoffSeconds);
    }

    /** Upload with the default backoff schedule. */
    public UploadOutcome upload(UploadTarget target, int maxAttempts) {
        return upload(target, maxAttempts, defaultBackoff);
    }

    /**
     * Upload {@code target.file()} with up to {@code maxAttempts} attempts.
     *
     * @return SUCCESS, the first FATAL_FAILURE, or the last RETRYABLE_FAILURE
     *         once the attempts are used up
     * @throws PublisherException with kind LOCAL_IO if the file does not exist;
     *         this is checked once, before the first attempt
     */
    public UploadOutcome upload(UploadTarget target, int maxAttempts, BackoffPolicy backoff) {
        if (!Files.isRegularFile(target.file())) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                    "File not found: " + target.file());
        }
        log.info("Uploading {} to {}", target.fileName(), target.endpoint());

        RetryDriver driver = new RetryDriver(backoff, sleeper);
        Timer.Sample sample = Timer.start(meterRegistry);
        UploadOutcome outcome = driver.run("upload " + target.fileName(), maxAttempts,
                attempt -> attemptOnce(target, attempt, maxAttempts));
        sample.stop(meterRegistry.timer("publisher.upload.duration", "target", target.endpoint().getHost()));

        if (outcome.isSuccess()) {
            log.info("Uploaded {} (id={})", target.fileName(), outcome.remoteId());
        } else {
            log.error("Upload of {} failed: {} {}", target.fileName(), outcome, outcome.message());
        }
        return outcome;
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private UploadOutcome attemptOnce(UploadTarget target, int attempt, int maxAttempts) {
        UploadOutcome outcome = send(target);
        log.debug("Attempt {}/{} for {}: {}", attempt, maxAttempts, target.fileName(), outcome);
        meterRegistry.counter("publisher.upload.attempts",
                "target", target.endpoint().getHost(),
                "result", outcome.kind().name().toLowerCase()).increment();
        return outcome;
    }

    private UploadOutcome send(UploadTarget target) {
        MultipartBody body = MultipartBody.builder()
                .file("file", target.file(), target.contentType())
                .build();
        HttpRequest req = HttpRequest.newBuilder()
                .uri(target.endpoint())
                .timeout(requestTimeout)
                .header("Content-Type",      body.contentType())
                .header("Accept",            "application/json")
                .header("X-Atlassian-Token", "no-check")
                .header("Authorization",     target.authorization())
                .POST(body.publisher())
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            return UploadOutcome.retryable(0, "transport error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    "Upload of " + target.fileName() + " interrupted", e);
        }

        int status = resp.statusCode();
        ResponseClass cls = StatusClassifier.classify(status, target.successCodes());
        return switch (cls) {
            case SUCCESS   -> UploadOutcome.success(status, remoteIdOf(resp.body(), target.fileName()));
            case RETRYABLE -> UploadOutcome.retryable(status, resp.body());
            case FATAL     -> UploadOutcome.fatal(status, resp.body());
        };
    }

    /**
     * Pull the attachment id out of the response.
     *
     * The issue tracker answers with an array of attachments, the wiki with
     * {@code {"results":[...]}}; a 204 has no body at all. Falls back to the
     * file name.
     */
    private String remoteIdOf(String body, String fallback) {
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode root = json.readTree(body);
            JsonNode first = root;
            if (root.isArray() && !root.isEmpty()) {
                first = root.get(0);
            } else if (root.has("results") && root.get("results").isArray() && !root.get("results").isEmpty()) {
                first = root.get("results").get(0);
            }
            JsonNode id = first.get("id");
            return id != null && !id.asText().isBlank() ? id.asText() : fallback;
        } catch (IOException e) {
            log.debug("Upload response is not JSON, using file name as id: {}", e.getMessage());
            return fallback;
        }
    }
}
