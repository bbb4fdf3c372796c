package uk.gegc.revisionhelper.features.revision.domain.model;

import java.time.Instant;

/**
 * A stored, graded answer. Correctness is derived from the score and cannot be set on its own.
 */
public record Answer(
        String id,
        String runId,
        String questionId,
        String questionText,
        String studentAnswer,
        Score score,
        String correctAnswer,
        String explanation,
        String error,
        Instant answeredAt
) {
    public Answer {
        if (score == null) {
            score = Score.INCORRECT;
        }
        if (correctAnswer == null) {
            correctAnswer = "";
        }
    }

    public boolean isCorrect() {
        return score == Score.FULL_MARKS;
    }
}
