package com.testops.publisher.summary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts pass/fail/error/skip counts from free-text test runner output,
 * e.g. the last line of a pytest run:
 *
 *   "===== 12 passed, 3 failed, 1 skipped in 1.20s ====="
 *
 * Each counter is the first "<number> <label>" match, case-insensitive.
 * A missing label counts as zero, so empty output is a valid (all-zero) run.
 */
public final class ResultSummaryExtractor {

    private static final Logger log = LoggerFactory.getLogger(ResultSummaryExtractor.class);

    private static final Pattern PASSED  = Pattern.compile("(\\d+)\\s+passed",  Pattern.CASE_INSENSITIVE);
    private static final Pattern FAILED  = Pattern.compile("(\\d+)\\s+failed",  Pattern.CASE_INSENSITIVE);
    private static final Pattern ERRORS  = Pattern.compile("(\\d+)\\s+errors?", Pattern.CASE_INSENSITIVE);
    private static final Pattern SKIPPED = Pattern.compile("(\\d+)\\s+skipped", Pattern.CASE_INSENSITIVE);

    private ResultSummaryExtractor() {}

    public static TestSummary extract(String rawText) {
        String text = rawText == null ? "" : rawText;
        return TestSummary.of(
                firstCount(PASSED,  text),
                firstCount(FAILED,  text),
                firstCount(ERRORS,  text),
                firstCount(SKIPPED, text));
    }

    /**
     * Read and extract a log file. A missing file is not an error: the
     * result is {@link TestSummary#unavailable()}. Undecodable bytes are
     * replaced rather than rejected.
     */
    public static TestSummary extract(Path logFile) {
        if (!Files.isRegularFile(logFile)) {
            log.warn("No test output at {}, status will be UNKNOWN", logFile);
            return TestSummary.unavailable();
        }
        try {
            byte[] bytes = Files.readAllBytes(logFile);
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return extract(text);
        } catch (IOException e) {
            log.warn("Could not read test output {}: {}", logFile, e.getMessage());
            return TestSummary.unavailable();
        }
    }

    private static int firstCount(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return 0;
        }
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // more digits than an int holds
            return Integer.MAX_VALUE;
        }
    }
}
