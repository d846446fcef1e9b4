package com.testops.publisher.summary;

/** Verdict of a test run as shown in reports and page titles. */
public enum OverallStatus {
    PASS,
    FAIL,
    /** No test output was available. */
    UNKNOWN
}
