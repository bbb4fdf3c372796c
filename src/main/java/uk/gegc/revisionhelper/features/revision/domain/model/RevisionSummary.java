package uk.gegc.revisionhelper.features.revision.domain.model;

import java.util.List;

/**
 * Graded result of one run.
 *
 * @param overallAccuracy average of the tier points over answered questions, 0-100
 * @param complete        every question of the run has at least one answer
 */
public record RevisionSummary(
        String runId,
        String revisionId,
        List<Answer> answers,
        double overallAccuracy,
        int fullMarks,
        int partialMarks,
        int incorrect,
        int totalQuestions,
        boolean complete,
        int threshold,
        boolean thresholdMet
) {
    public RevisionSummary {
        answers = answers == null ? List.of() : List.copyOf(answers);
    }
}
