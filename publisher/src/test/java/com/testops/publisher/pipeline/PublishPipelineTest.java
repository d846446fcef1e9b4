package com.testops.publisher.pipeline;

import com.testops.publisher.PublisherException;
import com.testops.publisher.confluence.ConfluenceClient;
import com.testops.publisher.handoff.ExecutionReference;
import com.testops.publisher.handoff.HandoffFiles;
import com.testops.publisher.handoff.SourceSystem;
import com.testops.publisher.imports.ImportJob;
import com.testops.publisher.imports.ImportJobPoller;
import com.testops.publisher.imports.ImportJobSubmitter;
import com.testops.publisher.imports.ImportMetadata;
import com.testops.publisher.imports.ImportStatus;
import com.testops.publisher.jira.JiraClient;
import com.testops.publisher.retry.BackoffPolicy;
import com.testops.publisher.summary.OverallStatus;
import com.testops.publisher.upload.UploadOutcome;
import com.testops.publisher.upload.UploadTarget;
import com.testops.publisher.upload.UploadRetryEngine;
import com.testops.publisher.version.VersionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link PublishPipeline}.
 *
 * The remote clients and the upload engine are mocked; version store
 * behaviour is stubbed, while hand-off files and report artifacts are real
 * files in a temp directory.
 */
@ExtendWith(MockitoExtension.class)
class PublishPipelineTest {

    @Mock VersionStore       versionStore;
    @Mock UploadRetryEngine  uploadEngine;
    @Mock ImportJobSubmitter submitter;
    @Mock ImportJobPoller    poller;
    @Mock ConfluenceClient   confluence;
    @Mock JiraClient         jira;

    @TempDir Path tmp;

    Path             reportDir;
    HandoffFiles     handoff;
    PipelineSettings settings;
    PublishPipeline  pipeline;

    @BeforeEach
    void setUp() throws IOException {
        reportDir = Files.createDirectories(tmp.resolve("report"));
        handoff   = new HandoffFiles(
                tmp.resolve("rtm_execution_key.txt").toString(),
                reportDir.resolve("confluence_url.txt").toString(),
                "");
        settings  = new PipelineSettings(
                reportDir, "test_result_report", List.of("pdf", "html"),
                reportDir.resolve("pytest_output.txt"), "Test Result Report",
                7, BackoffPolicy.ofSeconds(2, 4, 6, 10, 15, 20, 30),
                3, BackoffPolicy.ofSeconds(2),
                Duration.ofSeconds(2), Duration.ofSeconds(900));
        Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);
        pipeline  = new PublishPipeline(versionStore, uploadEngine, submitter, poller,
                confluence, jira, handoff, settings, clock);
    }

    // ------------------------------------------------------------------
    // publish
    // ------------------------------------------------------------------

    @Test
    void publish_createsPageUploadsReportsAndLinksThem() throws Exception {
        when(versionStore.allocateNext()).thenReturn(7);
        writeReports(7);
        Files.writeString(settings.testLog(), "==== 8 passed, 2 skipped in 3.1s ====");
        stubWikiPage("555");
        when(uploadEngine.upload(any(UploadTarget.class), eq(7), eq(settings.wikiBackoff())))
                .thenReturn(UploadOutcome.success(200, "att1"), UploadOutcome.success(200, "att2"));

        PipelineResult result = pipeline.publish(PublishRequest.withoutImport(false));

        assertThat(result.version()).isEqualTo(7);
        assertThat(result.summary().overallStatus()).isEqualTo(OverallStatus.PASS);
        assertThat(result.uploadedIds()).containsExactly("att1", "att2");
        assertThat(result.pageUrl()).isEqualTo("https://wiki.example.com/spaces/QA/pages/555");
        assertThat(result.execution()).isEmpty();

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(confluence).updatePage(eq("555"),
                eq("Test Result Report v7 (PASS) - 2024-05-01 10-15-30"), body.capture(), eq(3));
        assertThat(body.getValue())
                .contains("dl/test_result_report_v7.pdf")
                .contains("dl/test_result_report_v7.html");
        assertThat(handoff.readPageUrl()).hasValue("https://wiki.example.com/spaces/QA/pages/555");
        verifyNoInteractions(submitter, poller, jira);
    }

    @Test
    void publish_reuseVersion_readsCurrentWithoutAllocating() throws Exception {
        when(versionStore.current()).thenReturn(4);
        writeReports(4);
        stubWikiPage("9");
        when(uploadEngine.upload(any(UploadTarget.class), eq(7), eq(settings.wikiBackoff())))
                .thenReturn(UploadOutcome.success(200, "a"));

        PipelineResult result = pipeline.publish(PublishRequest.withoutImport(true));

        assertThat(result.version()).isEqualTo(4);
        // no test log written: status is unknown rather than an error
        assertThat(result.summary().overallStatus()).isEqualTo(OverallStatus.UNKNOWN);
        verify(versionStore, never()).allocateNext();
    }

    @Test
    void publish_missingReportFile_abortsBeforeTouchingWiki() throws Exception {
        when(versionStore.allocateNext()).thenReturn(2);
        Files.writeString(reportDir.resolve("test_result_report_v2.pdf"), "pdf");

        assertThatThrownBy(() -> pipeline.publish(PublishRequest.withoutImport(false)))
                .isInstanceOf(PublisherException.class)
                .hasMessageContaining("test_result_report_v2.html")
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.LOCAL_IO);
        verify(confluence, never()).createPage(anyString(), anyString());
    }

    @Test
    void publish_unconfiguredWiki_doesNotSpendVersion() {
        doThrow(new PublisherException(PublisherException.Kind.CONFIGURATION, "Missing CONFLUENCE_BASE"))
                .when(confluence).requireConfigured();

        assertThatThrownBy(() -> pipeline.publish(PublishRequest.withoutImport(false)))
                .isInstanceOf(PublisherException.class);
        verifyNoInteractions(versionStore);
    }

    @Test
    void publish_exhaustedUpload_abortsWithoutPageUpdate() throws Exception {
        when(versionStore.allocateNext()).thenReturn(1);
        writeReports(1);
        when(confluence.createPage(anyString(), anyString())).thenReturn("42");
        when(confluence.attachmentTarget(eq("42"), any(Path.class)))
                .thenAnswer(inv -> uploadTarget(inv.getArgument(1)));
        when(uploadEngine.upload(any(UploadTarget.class), eq(7), eq(settings.wikiBackoff())))
                .thenReturn(UploadOutcome.retryable(503, "Service Unavailable"));

        assertThatThrownBy(() -> pipeline.publish(PublishRequest.withoutImport(false)))
                .isInstanceOf(PublisherException.class)
                .hasMessageContaining("test_result_report_v1.pdf")
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.TRANSIENT);
        verify(uploadEngine, times(1)).upload(any(), eq(7), any());
        verify(confluence, never()).updatePage(anyString(), anyString(), anyString(), eq(2));
        assertThat(handoff.readPageUrl()).isEmpty();
    }

    @Test
    void publish_withArchive_importsAfterPublishing() throws Exception {
        when(versionStore.allocateNext()).thenReturn(3);
        writeReports(3);
        stubWikiPage("77");
        when(uploadEngine.upload(any(UploadTarget.class), eq(7), eq(settings.wikiBackoff())))
                .thenReturn(UploadOutcome.success(200, "a"));
        Path archive = Files.writeString(tmp.resolve("results.zip"), "PK");
        ImportMetadata metadata = new ImportMetadata("QA", null, null, null);
        when(submitter.submit(archive, metadata)).thenReturn("task-1");
        when(poller.pollUntilTerminal("task-1", settings.pollInterval(), settings.pollDeadline()))
                .thenReturn(new ImportJob("task-1", ImportStatus.SUCCEEDED, 100, "QA-900", "SUCCEEDED"));

        PipelineResult result = pipeline.publish(new PublishRequest(false, archive, metadata));

        assertThat(result.execution()).hasValueSatisfying(ref -> {
            assertThat(ref.key()).isEqualTo("QA-900");
            assertThat(ref.sourceSystem()).isEqualTo(SourceSystem.TEST_MANAGEMENT);
        });
        assertThat(Files.readString(tmp.resolve("rtm_execution_key.txt"))).isEqualTo("QA-900");
    }

    // ------------------------------------------------------------------
    // import-results
    // ------------------------------------------------------------------

    @Test
    void importResults_noKeyFromJob_fallsBackToGivenKey() {
        Path archive = tmp.resolve("r.zip");
        ImportMetadata metadata = new ImportMetadata("QA", "JUNIT", null, "QA-3");
        when(submitter.submit(archive, metadata)).thenReturn("t");
        when(poller.pollUntilTerminal(eq("t"), any(), any()))
                .thenReturn(new ImportJob("t", ImportStatus.SUCCEEDED, 100, null, "SUCCEEDED"));

        ExecutionReference ref = pipeline.importResults(archive, metadata);

        assertThat(ref.key()).isEqualTo("QA-3");
    }

    @Test
    void importResults_noKeyAnywhere_isProtocolError() {
        Path archive = tmp.resolve("r.zip");
        ImportMetadata metadata = new ImportMetadata("QA", "JUNIT", null, null);
        when(submitter.submit(archive, metadata)).thenReturn("t");
        when(poller.pollUntilTerminal(eq("t"), any(), any()))
                .thenReturn(new ImportJob("t", ImportStatus.UNKNOWN, 100, null, "ARCHIVED"));

        assertThatThrownBy(() -> pipeline.importResults(archive, metadata))
                .isInstanceOf(PublisherException.class)
                .hasMessageContaining("ARCHIVED")
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.PROTOCOL);
    }

    @Test
    void importResults_failedJob_writesNothing() {
        Path archive = tmp.resolve("r.zip");
        ImportMetadata metadata = new ImportMetadata("QA", "JUNIT", null, null);
        when(submitter.submit(archive, metadata)).thenReturn("t");
        when(poller.pollUntilTerminal(eq("t"), any(), any()))
                .thenReturn(new ImportJob("t", ImportStatus.ERROR, 20, null, "ERROR"));

        assertThatThrownBy(() -> pipeline.importResults(archive, metadata))
                .isInstanceOf(PublisherException.class)
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.JOB_FAILED);
        assertThat(tmp.resolve("rtm_execution_key.txt")).doesNotExist();
    }

    // ------------------------------------------------------------------
    // attach-reports
    // ------------------------------------------------------------------

    @Test
    void attachReports_uploadsEachFileToRecordedIssue() throws Exception {
        handoff.writeExecutionKey(new ExecutionReference("QA-12", SourceSystem.TEST_MANAGEMENT));
        Path pdf  = Files.writeString(reportDir.resolve("a.pdf"), "pdf");
        Path html = Files.writeString(reportDir.resolve("a.html"), "html");
        ExecutionReference issue = new ExecutionReference("QA-12", SourceSystem.HANDOFF_FILE);
        when(jira.attachmentTarget(eq(issue), any(Path.class)))
                .thenAnswer(inv -> uploadTarget(inv.getArgument(1)));
        when(uploadEngine.upload(any(UploadTarget.class), eq(3), eq(settings.issueBackoff())))
                .thenReturn(UploadOutcome.success(200, "1"), UploadOutcome.success(200, "2"));

        ExecutionReference used = pipeline.attachReports(List.of(pdf, html));

        assertThat(used).isEqualTo(issue);
        verify(uploadEngine, times(2)).upload(any(), eq(3), eq(settings.issueBackoff()));
    }

    @Test
    void attachReports_missingFile_uploadsNothing() throws Exception {
        handoff.writeExecutionKey(new ExecutionReference("QA-12", SourceSystem.TEST_MANAGEMENT));
        Path pdf = Files.writeString(reportDir.resolve("a.pdf"), "pdf");
        when(jira.attachmentTarget(any(ExecutionReference.class), any(Path.class)))
                .thenAnswer(inv -> uploadTarget(inv.getArgument(1)));

        assertThatThrownBy(() -> pipeline.attachReports(List.of(pdf, reportDir.resolve("missing.html"))))
                .isInstanceOf(PublisherException.class)
                .hasMessageContaining("missing.html")
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.LOCAL_IO);
        verifyNoInteractions(uploadEngine);
    }

    @Test
    void attachReports_withoutKey_isConfigurationError() {
        assertThatThrownBy(() -> pipeline.attachReports(List.of(reportDir.resolve("a.pdf"))))
                .isInstanceOf(PublisherException.class)
                .extracting(e -> ((PublisherException) e).getKind())
                .isEqualTo(PublisherException.Kind.CONFIGURATION);
        verifyNoInteractions(jira, uploadEngine);
    }

    // ------------------------------------------------------------------
    // create-execution
    // ------------------------------------------------------------------

    @Test
    void createExecution_writesKeyToOutput() throws Exception {
        when(jira.createTestExecution("QA", "Nightly", "desc"))
                .thenReturn(new ExecutionReference("QA-321", SourceSystem.ISSUE_TRACKER));
        Path output = tmp.resolve("out/key.txt");

        ExecutionReference ref = pipeline.createExecution("QA", "Nightly", "desc", output);

        assertThat(ref.key()).isEqualTo("QA-321");
        assertThat(Files.readString(output)).isEqualTo("QA-321");
    }

    // ------------------------------------------------------------------
    // Object factories
    // ------------------------------------------------------------------

    private void writeReports(int version) throws IOException {
        Files.writeString(reportDir.resolve("test_result_report_v" + version + ".pdf"), "pdf");
        Files.writeString(reportDir.resolve("test_result_report_v" + version + ".html"), "<html/>");
    }

    private void stubWikiPage(String pageId) {
        when(confluence.createPage(anyString(), anyString())).thenReturn(pageId);
        when(confluence.attachmentTarget(eq(pageId), any(Path.class)))
                .thenAnswer(inv -> uploadTarget(inv.getArgument(1)));
        when(confluence.downloadLink(eq(pageId), anyString()))
                .thenAnswer(inv -> "dl/" + inv.getArgument(1));
        when(confluence.pageVersion(pageId)).thenReturn(2);
        when(confluence.pageUrl(pageId)).thenReturn("https://wiki.example.com/spaces/QA/pages/" + pageId);
    }

    private static UploadTarget uploadTarget(Path file) {
        return new UploadTarget(URI.create("https://wiki.example.com/att"), file,
                UploadTarget.contentTypeFor(file), Set.of(200, 201), "Basic x");
    }
}
