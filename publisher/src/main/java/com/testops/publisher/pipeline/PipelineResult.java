package com.testops.publisher.pipeline;

import com.testops.publisher.handoff.ExecutionReference;
import com.testops.publisher.summary.TestSummary;

import java.util.List;
import java.util.Optional;

/**
 * What a publish run produced.
 *
 * @param version            report version that was published
 * @param summary            counts read from the test log
 * @param pageUrl            URL of the wiki page
 * @param uploadedIds        remote ids of the uploaded attachments, in upload order
 * @param executionReference key persisted by the import step, null when no import ran
 */
public record PipelineResult(
        int                version,
        TestSummary        summary,
        String             pageUrl,
        List<String>       uploadedIds,
        ExecutionReference executionReference) {

    public Optional<ExecutionReference> execution() {
        return Optional.ofNullable(executionReference);
    }
}
