package com.testops.publisher.pipeline;

import com.testops.publisher.PublisherException;
import com.testops.publisher.confluence.ConfluenceClient;
import com.testops.publisher.confluence.ReportPage;
import com.testops.publisher.handoff.ExecutionReference;
import com.testops.publisher.handoff.HandoffFiles;
import com.testops.publisher.handoff.SourceSystem;
import com.testops.publisher.imports.ImportJob;
import com.testops.publisher.imports.ImportJobPoller;
import com.testops.publisher.imports.ImportJobSubmitter;
import com.testops.publisher.imports.ImportMetadata;
import com.testops.publisher.jira.JiraClient;
import com.testops.publisher.retry.BackoffPolicy;
import com.testops.publisher.summary.ResultSummaryExtractor;
import com.testops.publisher.summary.TestSummary;
import com.testops.publisher.upload.UploadOutcome;
import com.testops.publisher.upload.UploadRetryEngine;
import com.testops.publisher.upload.UploadTarget;
import com.testops.publisher.version.VersionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * The publishing stages CI invokes, each run start to finish in one process.
 *
 * Every stage is a strict sequence. The first failure aborts the stage with
 * a {@link PublisherException}; nothing is retried across steps and there is
 * no partial-success result.
 *
 *   publish:          version → artifacts → summary → wiki page + uploads → [import]
 *   import-results:   submit → poll → persist execution key
 *   attach-reports:   read execution key → upload each report to the issue
 *   create-execution: create issue → persist its key
 */
@Service
public class PublishPipeline {

    private static final Logger log = LoggerFactory.getLogger(PublishPipeline.class);

    private final VersionStore       versionStore;
    private final UploadRetryEngine  uploadEngine;
    private final ImportJobSubmitter submitter;
    private final ImportJobPoller    poller;
    private final ConfluenceClient   confluence;
    private final JiraClient         jira;
    private final HandoffFiles       handoff;
    private final PipelineSettings   settings;
    private final Clock              clock;

    public PublishPipeline(VersionStore versionStore,
                           UploadRetryEngine uploadEngine,
                           ImportJobSubmitter submitter,
                           ImportJobPoller poller,
                           ConfluenceClient confluence,
                           JiraClient jira,
                           HandoffFiles handoff,
                           PipelineSettings settings,
                           Clock clock) {
        this.versionStore = versionStore;
        this.uploadEngine = uploadEngine;
        this.submitter    = submitter;
        this.poller       = poller;
        this.confluence   = confluence;
        this.jira         = jira;
        this.handoff      = handoff;
        this.settings     = settings;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // publish
    // ------------------------------------------------------------------

    /**
     * Publish the current report version to the wiki and optionally import
     * the results archive.
     */
    public PipelineResult publish(PublishRequest request) {
        // fail on missing settings before a version number is spent
        confluence.requireConfigured();

        int version = request.reuseVersion() ? versionStore.current() : versionStore.allocateNext();
        MDC.put("version", "v" + version);
        try {
            log.info("Publishing report v{}", version);

            List<Path> artifacts = ArtifactLocator.locate(
                    settings.reportDir(), settings.baseName(), version, settings.extensions());

            TestSummary summary = ResultSummaryExtractor.extract(settings.testLog());
            log.info("Test summary: {} ({})", summary.describe(), summary.overallStatus());

            ReportPage page = new ReportPage(settings.pageTitle(), version, summary, LocalDateTime.now(clock));
            String pageId = confluence.createPage(page.title(), page.body());

            List<String> uploadedIds = new ArrayList<>();
            for (Path artifact : artifacts) {
                UploadOutcome outcome = uploadOrAbort(confluence.attachmentTarget(pageId, artifact),
                        settings.wikiUploadAttempts(), settings.wikiBackoff());
                uploadedIds.add(outcome.remoteId());
                String fileName = artifact.getFileName().toString();
                page.addLink(fileName, confluence.downloadLink(pageId, fileName));
            }

            int currentVersion = confluence.pageVersion(pageId);
            confluence.updatePage(pageId, page.title(), page.body(), currentVersion + 1);

            String pageUrl = confluence.pageUrl(pageId);
            handoff.writePageUrl(pageUrl);
            log.info("Published to {}", pageUrl);

            ExecutionReference execution = null;
            if (request.importArchive().isPresent()) {
                execution = importResults(request.archive(), request.importMetadata());
            }
            return new PipelineResult(version, summary, pageUrl, List.copyOf(uploadedIds), execution);
        } finally {
            MDC.remove("version");
        }
    }

    // ------------------------------------------------------------------
    // import-results
    // ------------------------------------------------------------------

    /**
     * Submit the archive, wait for the import to finish and persist the
     * resulting execution key for later stages.
     *
     * @throws PublisherException JOB_FAILED / TIMEOUT from the poll, PROTOCOL
     *         if the finished job reports no execution key and none was given
     */
    public ExecutionReference importResults(Path archive, ImportMetadata metadata) {
        String taskId = submitter.submit(archive, metadata);
        ImportJob job = poller.pollUntilTerminal(taskId, settings.pollInterval(), settings.pollDeadline())
                .requireSucceeded();

        String key = job.resultExecutionKey()
                .or(metadata::preexistingExecutionKey)
                .orElseThrow(() -> new PublisherException(PublisherException.Kind.PROTOCOL,
                        "Import " + taskId + " finished (" + job.rawStatus() + ") without a testExecutionKey"));

        ExecutionReference ref = new ExecutionReference(key, SourceSystem.TEST_MANAGEMENT);
        handoff.writeExecutionKey(ref);
        return ref;
    }

    // ------------------------------------------------------------------
    // attach-reports
    // ------------------------------------------------------------------

    /**
     * Attach report files to the execution issue recorded by an earlier stage.
     * Every file is checked before the first upload starts.
     */
    public ExecutionReference attachReports(List<Path> reports) {
        ExecutionReference issue = handoff.readExecutionKey();
        log.info("Attaching {} file(s) to {} (key from {})", reports.size(), issue.key(), issue.sourceSystem());

        List<UploadTarget> targets = new ArrayList<>();
        for (Path report : reports) {
            targets.add(jira.attachmentTarget(issue, report));
        }
        for (UploadTarget target : targets) {
            if (!Files.isRegularFile(target.file())) {
                throw new PublisherException(PublisherException.Kind.LOCAL_IO, "File not found: " + target.file());
            }
        }
        for (UploadTarget target : targets) {
            uploadOrAbort(target, settings.issueUploadAttempts(), settings.issueBackoff());
        }
        log.info("All attachments uploaded to {}", issue.key());
        return issue;
    }

    // ------------------------------------------------------------------
    // create-execution
    // ------------------------------------------------------------------

    /** Create a test execution issue and write its key to {@code output}. */
    public ExecutionReference createExecution(String projectKey, String summary, String description, Path output) {
        ExecutionReference ref = jira.createTestExecution(projectKey, summary, description);
        handoff.writeExecutionKey(ref, output);
        return ref;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private UploadOutcome uploadOrAbort(UploadTarget target, int attempts, BackoffPolicy backoff) {
        UploadOutcome outcome = uploadEngine.upload(target, attempts, backoff);
        if (!outcome.isSuccess()) {
            throw outcome.toException("Upload of " + target.fileName());
        }
        return outcome;
    }
}
