package uk.gegc.revisionhelper.features.revision.domain.model;

import java.time.Instant;

/**
 * One learner's attempt at a revision. The owner is the caller that started it,
 * not the revision's owner.
 */
public record Run(
        String id,
        String revisionId,
        RunStatus status,
        String userId,
        String sessionId,
        Instant createdAt
) {
}
