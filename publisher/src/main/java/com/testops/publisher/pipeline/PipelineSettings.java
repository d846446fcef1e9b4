package com.testops.publisher.pipeline;

import com.testops.publisher.retry.BackoffPolicy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Tunables of the publishing stages, bound from {@code publisher.*} in
 * application.yml by {@link com.testops.publisher.config.PublisherConfig}.
 *
 * @param reportDir           directory holding the rendered reports and the test log
 * @param baseName            report file stem; files are {@code <baseName>_v<version>.<ext>}
 * @param extensions          extensions that must exist for a version, e.g. pdf, html
 * @param testLog             raw test runner output the summary is read from
 * @param pageTitle           prefix of the wiki page title
 * @param wikiUploadAttempts  attempt budget per wiki attachment
 * @param wikiBackoff         backoff between wiki attachment attempts
 * @param issueUploadAttempts attempt budget per issue-tracker attachment
 * @param issueBackoff        backoff between issue-tracker attachment attempts
 * @param pollInterval        wait between import status requests
 * @param pollDeadline        give up polling an import after this long
 */
public record PipelineSettings(
        Path          reportDir,
        String        baseName,
        List<String>  extensions,
        Path          testLog,
        String        pageTitle,
        int           wikiUploadAttempts,
        BackoffPolicy wikiBackoff,
        int           issueUploadAttempts,
        BackoffPolicy issueBackoff,
        Duration      pollInterval,
        Duration      pollDeadline) {

    public PipelineSettings {
        extensions = List.copyOf(extensions);
    }
}
