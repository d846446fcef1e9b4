package com.testops.publisher.handoff;

/** Where an execution key came from. */
public enum SourceSystem {
    /** Returned by a finished results import. */
    TEST_MANAGEMENT,
    /** Created directly as an issue-tracker issue. */
    ISSUE_TRACKER,
    /** Supplied through the RTM_EXECUTION_KEY environment variable. */
    ENVIRONMENT,
    /** Read back from a hand-off file written by an earlier stage. */
    HANDOFF_FILE
}
