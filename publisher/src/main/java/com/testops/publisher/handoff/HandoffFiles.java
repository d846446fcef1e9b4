package com.testops.publisher.handoff;

import com.testops.publisher.PublisherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Plain-text files through which CI stages pass results to later stages.
 *
 * Stages run as separate processes (often separate CI jobs sharing a
 * workspace), so these files are the only channel between them. Writes go
 * through a temporary file and an atomic move so a reader never sees a
 * half-written key.
 */
@Component
public class HandoffFiles {

    private static final Logger log = LoggerFactory.getLogger(HandoffFiles.class);

    private final Path   executionKeyFile;
    private final Path   pageUrlFile;
    private final String executionKeyOverride;

    public HandoffFiles(@Value("${publisher.handoff.execution-key-file:rtm_execution_key.txt}") String executionKeyFile,
                        @Value("${publisher.handoff.page-url-file:report/confluence_url.txt}") String pageUrlFile,
                        @Value("${publisher.handoff.execution-key:}") String executionKeyOverride) {
        this.executionKeyFile     = Path.of(executionKeyFile);
        this.pageUrlFile          = Path.of(pageUrlFile);
        this.executionKeyOverride = executionKeyOverride;
    }

    public void writeExecutionKey(ExecutionReference ref) {
        writeExecutionKey(ref, executionKeyFile);
    }

    public void writeExecutionKey(ExecutionReference ref, Path target) {
        write(target, ref.key());
        log.info("Execution key {} ({}) saved to {}", ref.key(), ref.sourceSystem(), target);
    }

    /**
     * Resolve the execution key for a later stage: the configured override
     * (RTM_EXECUTION_KEY) first, then the hand-off file.
     *
     * @throws PublisherException CONFIGURATION if neither exists, PROTOCOL if
     *         the key is malformed
     */
    public ExecutionReference readExecutionKey() {
        if (executionKeyOverride != null && !executionKeyOverride.isBlank()) {
            return new ExecutionReference(executionKeyOverride, SourceSystem.ENVIRONMENT);
        }
        String content = read(executionKeyFile).orElseThrow(() ->
                new PublisherException(PublisherException.Kind.CONFIGURATION,
                        "Missing " + executionKeyFile + " and RTM_EXECUTION_KEY environment variable"));
        return new ExecutionReference(content, SourceSystem.HANDOFF_FILE);
    }

    public void writePageUrl(String url) {
        write(pageUrlFile, url);
        log.info("Page URL saved to {}", pageUrlFile);
    }

    public Optional<String> readPageUrl() {
        return read(pageUrlFile);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private static Optional<String> read(Path file) {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            String s = Files.readString(file, StandardCharsets.UTF_8).strip();
            return s.isEmpty() ? Optional.empty() : Optional.of(s);
        } catch (IOException e) {
            throw new PublisherException(PublisherException.Kind.LOCAL_IO, "Could not read " + file, e);
        }
    }

    private static void write(Path file, String content) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            PublisherException failure =
                    new PublisherException(PublisherException.Kind.LOCAL_IO, "Could not write " + file, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }
}
