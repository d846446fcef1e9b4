package com.testops.publisher.imports;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.testops.publisher.PublisherException;
import com.testops.publisher.retry.Sleeper;
import com.testops.publisher.retry.StatusClassifier;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Polls an import job until the server reports a terminal status or the
 * client-side deadline elapses.
 *
 * One request at a time, strictly sequential. Each wait is the poll
 * interval capped by the time left before the deadline, so the deadline is
 * honoured to within one status request.
 */
@Component
public class ImportJobPoller {

    private static final Logger log = LoggerFactory.getLogger(ImportJobPoller.class);

    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(30);

    /** Body of the status endpoint; other fields are ignored. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatusResponse(String status, Integer progress, String testExecutionKey) {}

    private final HttpClient    http;
    private final ObjectMapper  json;
    private final RtmEndpoint   endpoint;
    private final Sleeper       sleeper;
    private final Clock         clock;
    private final MeterRegistry meterRegistry;

    public ImportJobPoller(HttpClient http,
                           ObjectMapper objectMapper,
                           RtmEndpoint endpoint,
                           Sleeper sleeper,
                           Clock clock,
                           MeterRegistry meterRegistry) {
        this.http          = http;
        this.json          = objectMapper;
        this.endpoint      = endpoint;
        this.sleeper       = sleeper;
        this.clock         = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Poll until the job leaves SUBMITTED/IMPORTING or {@code deadline} has elapsed.
     *
     * @return the terminal job: SUCCEEDED, FAILED, ERROR, UNKNOWN, or TIMEOUT
     *         (client-side; the job may still be running remotely). Use
     *         {@link ImportJob#requireSucceeded()} to turn failures into exceptions.
     * @throws PublisherException for a non-retryable status response or an
     *         unreadable body, or CANCELLED if a wait was cancelled
     */
    public ImportJob pollUntilTerminal(String jobId, Duration pollInterval, Duration deadline) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
        Instant start = clock.instant();
        ImportJob job = ImportJob.submitted(jobId);
        int tick = 0;

        while (true) {
            tick++;
            job = fetch(job, tick).orElse(job);
            meterRegistry.counter("publisher.import.polls", "status", job.status().name().toLowerCase()).increment();

            if (job.status().isTerminal()) {
                log.info("Import {} reached {} after {} polls (progress {}%)",
                        jobId, job.status(), tick, job.progress());
                return job;
            }

            Duration remaining = deadline.minus(Duration.between(start, clock.instant()));
            if (remaining.isNegative() || remaining.isZero()) {
                log.error("Import {} not finished after {} s (last status {}, {}%), giving up",
                        jobId, deadline.toSeconds(), job.status(), job.progress());
                return job.timedOut();
            }
            await(jobId, remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /**
     * One status request. Empty when the request failed in a way worth
     * polling through (transport error, 408/429/5xx); the previous state is kept.
     */
    private Optional<ImportJob> fetch(ImportJob previous, int tick) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(endpoint.statusUri(previous.jobId()))
                .timeout(STATUS_TIMEOUT)
                .header("Accept",        "application/json")
                .header("Authorization", endpoint.authorization())
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.warn("Status request {} for import {} failed: {}", tick, previous.jobId(), e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    "Polling of import " + previous.jobId() + " interrupted", e);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            if (StatusClassifier.isRetryableStatus(status)) {
                log.warn("Status request {} for import {} returned HTTP {}, will poll again",
                        tick, previous.jobId(), status);
                return Optional.empty();
            }
            throw PublisherException.forResponse("Import status request", status, resp.body());
        }

        StatusResponse parsed;
        try {
            parsed = json.readValue(resp.body(), StatusResponse.class);
        } catch (JsonProcessingException e) {
            throw new PublisherException(PublisherException.Kind.PROTOCOL,
                    "Unreadable import status response", status, resp.body());
        }
        ImportJob job = new ImportJob(previous.jobId(),
                ImportStatus.fromServer(parsed.status()),
                parsed.progress() == null ? previous.progress() : parsed.progress(),
                parsed.testExecutionKey(),
                parsed.status());
        log.info("Import {} status: {} progress: {}%", job.jobId(), job.rawStatus(), job.progress());
        return Optional.of(job);
    }

    private void await(String jobId, Duration wait) {
        try {
            sleeper.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    "Polling of import " + jobId + " interrupted", e);
        } catch (CancellationException e) {
            throw new PublisherException(PublisherException.Kind.CANCELLED,
                    "Polling of import " + jobId + " cancelled", e);
        }
    }
}
