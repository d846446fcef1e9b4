package com.testops.publisher.config;

import com.testops.publisher.pipeline.PipelineSettings;
import com.testops.publisher.retry.BackoffPolicy;
import com.testops.publisher.retry.CancellableSleeper;
import com.testops.publisher.version.FileVersionStore;
import com.testops.publisher.version.VersionStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;

/**
 * Shared infrastructure beans. Everything tunable comes from the
 * {@code publisher.*} keys in application.yml, which default to the
 * environment variables the CI jobs export.
 */
@Configuration
public class PublisherConfig {

    @Bean
    public HttpClient httpClient(@Value("${publisher.http.connect-timeout-seconds:10}") long connectTimeout) {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(connectTimeout))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * All retry and poll waits go through this sleeper. Closing the context
     * (SIGTERM from the CI runner) cancels it, which ends a wait in progress
     * with a CANCELLED failure instead of leaving the job hanging.
     */
    @Bean(destroyMethod = "cancel")
    public CancellableSleeper sleeper() {
        return new CancellableSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public VersionStore versionStore(@Value("${publisher.report.version-file:report/version.txt}") String file) {
        return new FileVersionStore(Path.of(file));
    }

    @Bean
    public PipelineSettings pipelineSettings(
            @Value("${publisher.report.dir:report}") String reportDir,
            @Value("${publisher.report.base-name:test_result_report}") String baseName,
            @Value("${publisher.report.extensions:pdf,html}") String[] extensions,
            @Value("${publisher.report.test-log:report/pytest_output.txt}") String testLog,
            @Value("${publisher.confluence.title:Test Result Report}") String pageTitle,
            @Value("${publisher.confluence.upload-attempts:7}") int wikiAttempts,
            @Value("${publisher.confluence.backoff-seconds:2,4,6,10,15,20,30}") long[] wikiBackoff,
            @Value("${publisher.jira.upload-attempts:3}") int issueAttempts,
            @Value("${publisher.jira.backoff-seconds:2}") long[] issueBackoff,
            @Value("${publisher.rtm.poll-interval-seconds:2}") long pollInterval,
            @Value("${publisher.rtm.poll-deadline-seconds:900}") long pollDeadline) {
        return new PipelineSettings(
                Path.of(reportDir),
                baseName,
                Arrays.stream(extensions).map(String::strip).filter(s -> !s.isEmpty()).toList(),
                Path.of(testLog),
                pageTitle,
                wikiAttempts,
                BackoffPolicy.ofSeconds(wikiBackoff),
                issueAttempts,
                BackoffPolicy.ofSeconds(issueBackoff),
                Duration.ofSeconds(pollInterval),
                Duration.ofSeconds(pollDeadline));
    }
}
