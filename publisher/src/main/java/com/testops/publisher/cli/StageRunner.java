package com.testops.publisher.cli;

import com.testops.publisher.PublisherException;
import com.testops.publisher.handoff.ExecutionReference;
import com.testops.publisher.imports.ImportMetadata;
import com.testops.publisher.pipeline.PipelineResult;
import com.testops.publisher.pipeline.PublishPipeline;
import com.testops.publisher.pipeline.PublishRequest;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Command-line entry: {@code publisher <stage> --option=value ...}.
 *
 * Runs exactly one stage and records the exit code: 0 on success, 1 on any
 * failure. Failures are reported here and nowhere else, with the raw
 * response body when there is one.
 */
@Component
public class StageRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    static final String USAGE = """
            Usage: publisher <stage> [--option=value ...]
              publish           [--reuse-version] [--archive=<zip> --project=<key> [--job-url=<url>] [--execution-key=<key>]]
              import-results    --archive=<zip> --project=<key> [--rtm-base=<url>] [--job-url=<url>] [--execution-key=<key>] [--report-type=JUNIT]
              attach-reports    --pdf=<file> --html=<file>
              create-execution  --project=<key> --summary=<text> --output=<file> [--description=<text>]
            """;

    private final PublishPipeline pipeline;
    private final MeterRegistry   meterRegistry;
    private final String          defaultJobUrl;

    private int exitCode = 0;

    public StageRunner(PublishPipeline pipeline,
                       MeterRegistry meterRegistry,
                       @Value("${publisher.rtm.job-url:}") String defaultJobUrl) {
        this.pipeline      = pipeline;
        this.meterRegistry = meterRegistry;
        this.defaultJobUrl = defaultJobUrl;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        Optional<Stage> stage = commands.isEmpty() ? Optional.empty() : Stage.fromCommand(commands.get(0));
        if (stage.isEmpty()) {
            log.error("Unknown or missing stage {}\n{}", commands, USAGE);
            exitCode = 1;
            return;
        }

        MDC.put("stage", stage.get().command());
        try {
            execute(stage.get(), args);
            log.info("Stage {} completed", stage.get().command());
            exitCode = 0;
        } catch (PublisherException e) {
            log.error("Stage {} failed: {}", stage.get().command(), e.getMessage(), e.getCause());
            if (e.getResponseBody() != null && !e.getResponseBody().isBlank()) {
                log.error("Response body: {}", e.getResponseBody());
            }
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Stage {} failed unexpectedly", stage.get().command(), e);
            exitCode = 1;
        } finally {
            logMetrics();
            MDC.remove("stage");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    // ------------------------------------------------------------------
    // Stage dispatch
    // ------------------------------------------------------------------

    private void execute(Stage stage, ApplicationArguments args) {
        switch (stage) {
            case PUBLISH -> {
                Optional<String> archive = option(args, "archive");
                PublishRequest request = archive.isPresent()
                        ? new PublishRequest(args.containsOption("reuse-version"), Path.of(archive.get()), metadata(args))
                        : PublishRequest.withoutImport(args.containsOption("reuse-version"));
                PipelineResult result = pipeline.publish(request);
                log.info("Report v{} ({}) published: {}", result.version(),
                        result.summary().overallStatus(), result.pageUrl());
                result.execution().ifPresent(ref -> log.info("Test execution: {}", ref.key()));
            }
            case IMPORT_RESULTS -> {
                ExecutionReference ref = pipeline.importResults(Path.of(required(args, "archive")), metadata(args));
                log.info("Test execution: {}", ref.key());
            }
            case ATTACH_REPORTS -> pipeline.attachReports(List.of(
                    Path.of(required(args, "pdf")),
                    Path.of(required(args, "html"))));
            case CREATE_EXECUTION -> {
                ExecutionReference ref = pipeline.createExecution(
                        required(args, "project"),
                        required(args, "summary"),
                        option(args, "description").orElse("Automated Test Execution run via CI pipeline"),
                        Path.of(required(args, "output")));
                log.info("Test execution: {}", ref.key());
            }
        }
    }

    private ImportMetadata metadata(ApplicationArguments args) {
        return new ImportMetadata(
                required(args, "project"),
                option(args, "report-type").orElse(ImportMetadata.DEFAULT_REPORT_TYPE),
                option(args, "job-url").orElse(defaultJobUrl),
                option(args, "execution-key").orElse(null));
    }

    private static Optional<String> option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0) == null || values.get(0).isBlank()) {
            return Optional.empty();
        }
        return Optional.of(values.get(0).strip());
    }

    private static String required(ApplicationArguments args, String name) {
        return option(args, name).orElseThrow(() -> new PublisherException(
                PublisherException.Kind.CONFIGURATION, "Missing required option --" + name + "=<value>"));
    }

    /** One-line digest of the counters recorded during the stage. */
    private void logMetrics() {
        String digest = meterRegistry.getMeters().stream()
                .filter(m -> m instanceof Counter)
                .map(m -> m.getId().getName() + m.getId().getTags().stream()
                        .map(t -> t.getKey() + "=" + t.getValue())
                        .collect(Collectors.joining(",", "{", "}"))
                        + "=" + (long) ((Counter) m).count())
                .sorted()
                .collect(Collectors.joining(" "));
        if (!digest.isEmpty()) {
            log.info("Metrics: {}", digest);
        }
    }
}
