package com.testops.publisher.imports;

import com.testops.publisher.PublisherException;

import java.util.Optional;

/**
 * Latest known state of an import job.
 *
 * @param jobId        task id returned by the submission
 * @param status       last status reported by the server, or TIMEOUT
 * @param progress     0..100
 * @param executionKey key of the test execution the import produced, if reported
 * @param rawStatus    status string exactly as the server sent it
 */
public record ImportJob(String jobId, ImportStatus status, int progress, String executionKey, String rawStatus) {

    public ImportJob {
        progress = Math.max(0, Math.min(100, progress));
    }

    public static ImportJob submitted(String jobId) {
        return new ImportJob(jobId, ImportStatus.SUBMITTED, 0, null, null);
    }

    public Optional<String> resultExecutionKey() {
        return executionKey == null || executionKey.isBlank() ? Optional.empty() : Optional.of(executionKey);
    }

    /** Same job, marked as abandoned by the client. */
    public ImportJob timedOut() {
        return new ImportJob(jobId, ImportStatus.TIMEOUT, progress, executionKey, rawStatus);
    }

    /**
     * Return this job if it did not fail or time out.
     *
     * @throws PublisherException JOB_FAILED for FAILED/ERROR, TIMEOUT for TIMEOUT
     */
    public ImportJob requireSucceeded() {
        if (status.isFailure()) {
            throw new PublisherException(PublisherException.Kind.JOB_FAILED,
                    "Import job " + jobId + " ended with status " + status);
        }
        if (status == ImportStatus.TIMEOUT) {
            throw new PublisherException(PublisherException.Kind.TIMEOUT,
                    "Import job " + jobId + " still " + (rawStatus == null ? "running" : rawStatus)
                    + " at " + progress + "% when the poll deadline elapsed");
        }
        return this;
    }
}
