package com.testops.publisher.summary;

import java.util.Locale;

/**
 * Counts extracted from one test run's output.
 *
 * @param available false when there was no output to read at all; the counts
 *                  are then zero and the status is UNKNOWN
 */
public record TestSummary(int passed, int failed, int errors, int skipped, boolean available) {

    public TestSummary {
        if (passed < 0 || failed < 0 || errors < 0 || skipped < 0) {
            throw new IllegalArgumentException("Counts must be non-negative");
        }
    }

    public static TestSummary of(int passed, int failed, int errors, int skipped) {
        return new TestSummary(passed, failed, errors, skipped, true);
    }

    public static TestSummary unavailable() {
        return new TestSummary(0, 0, 0, 0, false);
    }

    /** Sum of all counts; a long, since each count may be saturated at Integer.MAX_VALUE. */
    public long total() {
        return (long) passed + failed + errors + skipped;
    }

    /** Percentage of passed tests; 0 when nothing ran. */
    public double passRate() {
        long total = total();
        return total == 0 ? 0.0 : passed * 100.0 / total;
    }

    /** PASS iff nothing failed or errored; skipped tests do not count either way. */
    public OverallStatus overallStatus() {
        if (!available) {
            return OverallStatus.UNKNOWN;
        }
        return failed == 0 && errors == 0 ? OverallStatus.PASS : OverallStatus.FAIL;
    }

    /** e.g. {@code 12 passed | 3 failed | 0 errors | 0 skipped - Pass rate: 80.0%} */
    public String describe() {
        if (!available) {
            return "No test output found";
        }
        return String.format(Locale.ROOT, "%d passed | %d failed | %d errors | %d skipped - Pass rate: %.1f%%",
                passed, failed, errors, skipped, passRate());
    }
}
