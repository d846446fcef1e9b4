package com.testops.publisher.imports;

import com.testops.publisher.PublisherException;
import com.testops.publisher.upload.MultipartBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Submits a results archive to the test-management import API.
 *
 * Submission is never retried here: resending a large archive after an
 * ambiguous failure can create a second import job. Callers that want a
 * retry repeat the whole submit-and-poll sequence.
 */
@Component
public class ImportJobSubmitter {

    private static final Logger log = LoggerFactory.getLogger(ImportJobSubmitter.class);

    private final HttpClient   http;
    private final RtmEndpoint  endpoint;
    private final TaskIdParser taskIdParser;
    private final Duration     requestTimeout;

    public ImportJobSubmitter(HttpClient http,
                              RtmEndpoint endpoint,
                              TaskIdParser taskIdParser,
                              @Value("${publisher.rtm.submit-timeout-seconds:300}") long timeoutSeconds) {
        this.http           = http;
        this.endpoint       = endpoint;
        this.taskIdParser   = taskIdParser;
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
    }

    /**
     * Upload the archive and start an import.
     *
     * @return the task id to poll
     * @throws PublisherException LOCAL_IO if the archive is missing, the
     *         status-derived kind for a non-2xx response, TRANSIENT for a
     *         transport failure, PROTOCOL if no task id can be read
     */
    public String submit(Path archive, ImportMetadata metadata) {
        if (!Files.isRegularFile(archive)) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO,
                    "Results archive not found: " + archive);
        }
        log.info("Submitting {} for import into project {} (reportType={})",
                archive.getFileName(), metadata.projectKey(), metadata.reportType());

        MultipartBody.Builder form = MultipartBody.builder()
                .field("projectKey", metadata.projectKey())
                .field("reportType", metadata.reportType())
                .field("jobUrl",     metadata.jobUrl());
        metadata.preexistingExecutionKey().ifPresent(key -> form.field("testExecutionKey", key));
        MultipartBody body = form.file("file", archive, "application/zip").build();

        HttpRequest req = HttpRequest.newBuilder()
                .uri(endpoint.importUri())
                .timeout(requestTimeout)
                .header("Content-Type",  body.contentType())
                .header("Authorization", endpoint.authorization())
                .POST(body.publisher())
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PublisherException(PublisherException.Kind.TRANSIENT,
                    "Import submission failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublisherException(PublisherException.Kind.CANCELLED, "Import submission interrupted", e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw PublisherException.forResponse("Import submission", resp.statusCode(), resp.body());
        }

        ParsedTaskId parsed = taskIdParser.parse(resp.body());
        log.info("Import task {} accepted (HTTP {}, id from {})",
                parsed.taskId(), resp.statusCode(), parsed.source());
        return parsed.taskId();
    }
}
