package uk.gegc.revisionhelper.features.revision.domain.model;

import java.time.Instant;

/**
 * History entry for a run that has at least one answer.
 */
public record RunSummary(
        String runId,
        String revisionId,
        String revisionName,
        String subject,
        Instant completedAt,
        double score,
        int totalQuestions,
        int threshold
) {
}
