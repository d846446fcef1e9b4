package com.testops.publisher.summary;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ResultSummaryExtractorTest {

    @TempDir Path tmp;

    @Test
    void pytestSummaryLine_isParsed() {
        TestSummary s = ResultSummaryExtractor.extract("===== 12 passed, 3 failed in 1.20s =====");

        assertThat(s.passed()).isEqualTo(12);
        assertThat(s.failed()).isEqualTo(3);
        assertThat(s.errors()).isZero();
        assertThat(s.passRate()).isCloseTo(80.0, within(1e-9));
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.FAIL);
        assertThat(s.describe()).isEqualTo("12 passed | 3 failed | 0 errors | 0 skipped - Pass rate: 80.0%");
    }

    @Test
    void emptyOutput_isAllZeroPass() {
        TestSummary s = ResultSummaryExtractor.extract("");

        assertThat(s.total()).isZero();
        assertThat(s.passRate()).isZero();
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.PASS);
    }

    @Test
    void singularErrorAndMixedCase_areRecognised() {
        TestSummary s = ResultSummaryExtractor.extract("5 PASSED, 1 error, 2 Skipped");

        assertThat(s.errors()).isEqualTo(1);
        assertThat(s.skipped()).isEqualTo(2);
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.FAIL);
    }

    @Test
    void skippedTests_doNotAffectStatus() {
        TestSummary s = ResultSummaryExtractor.extract("4 passed, 6 skipped");

        assertThat(s.overallStatus()).isEqualTo(OverallStatus.PASS);
        assertThat(s.passRate()).isCloseTo(40.0, within(1e-9));
    }

    @Test
    void firstMatchWins() {
        TestSummary s = ResultSummaryExtractor.extract("retry: 1 failed\n=== 9 passed, 2 failed ===");

        assertThat(s.failed()).isEqualTo(1);
    }

    @Test
    void hugeCount_saturates() {
        assertThat(ResultSummaryExtractor.extract("99999999999 passed").passed()).isEqualTo(Integer.MAX_VALUE);
    }

    @Test
    void saturatedCounts_keepTotalAndPassRateInRange() {
        TestSummary s = ResultSummaryExtractor.extract("99999999999 passed, 1 failed");

        assertThat(s.total()).isEqualTo((long) Integer.MAX_VALUE + 1);
        assertThat(s.passRate()).isBetween(0.0, 100.0);
        assertThat(s.passRate()).isCloseTo(100.0 * Integer.MAX_VALUE / ((long) Integer.MAX_VALUE + 1), within(1e-9));
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.FAIL);
    }

    @Test
    void everyCountSaturated_totalDoesNotWrap() {
        TestSummary s = TestSummary.of(Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE, Integer.MAX_VALUE);

        assertThat(s.total()).isEqualTo(4L * Integer.MAX_VALUE);
        assertThat(s.passRate()).isCloseTo(25.0, within(1e-9));
    }

    @Test
    void missingFile_isUnknown() {
        TestSummary s = ResultSummaryExtractor.extract(tmp.resolve("pytest_output.txt"));

        assertThat(s.available()).isFalse();
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.UNKNOWN);
        assertThat(s.describe()).isEqualTo("No test output found");
    }

    @Test
    void fileWithInvalidUtf8_isStillRead() throws Exception {
        Path log = tmp.resolve("pytest_output.txt");
        byte[] prefix = {(byte) 0xff, (byte) 0xfe, '\n'};
        byte[] tail = "7 passed in 0.3s".getBytes();
        byte[] all = new byte[prefix.length + tail.length];
        System.arraycopy(prefix, 0, all, 0, prefix.length);
        System.arraycopy(tail, 0, all, prefix.length, tail.length);
        Files.write(log, all);

        TestSummary s = ResultSummaryExtractor.extract(log);

        assertThat(s.passed()).isEqualTo(7);
        assertThat(s.overallStatus()).isEqualTo(OverallStatus.PASS);
    }
}
