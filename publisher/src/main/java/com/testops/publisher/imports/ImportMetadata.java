package com.testops.publisher.imports;

import java.util.Optional;

/**
 * Form fields sent alongside the results archive.
 *
 * @param projectKey   project the results belong to
 * @param reportType   archive format, e.g. {@code JUNIT}
 * @param jobUrl       link back to the CI job ({@code N/A} when unknown)
 * @param executionKey existing test execution to import into; null to let
 *                     the service create a new one
 */
public record ImportMetadata(String projectKey, String reportType, String jobUrl, String executionKey) {

    public static final String DEFAULT_REPORT_TYPE = "JUNIT";

    public ImportMetadata {
        if (projectKey == null || projectKey.isBlank()) {
            throw new IllegalArgumentException("projectKey is required");
        }
        if (reportType == null || reportType.isBlank()) {
            reportType = DEFAULT_REPORT_TYPE;
        }
        if (jobUrl == null || jobUrl.isBlank()) {
            jobUrl = "N/A";
        }
    }

    public Optional<String> preexistingExecutionKey() {
        return executionKey == null || executionKey.isBlank() ? Optional.empty() : Optional.of(executionKey);
    }
}
