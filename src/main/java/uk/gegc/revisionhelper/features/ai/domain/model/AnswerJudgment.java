package uk.gegc.revisionhelper.features.ai.domain.model;

import uk.gegc.revisionhelper.features.revision.domain.model.Score;

/**
 * Grading result read from a model response. A failed judgment keeps the score at
 * {@link Score#INCORRECT}, carries a description in {@code error} and has no explanation.
 */
public record AnswerJudgment(
        Score score,
        String correctAnswer,
        String explanation,
        String error
) {
    public AnswerJudgment {
        if (score == null) {
            score = Score.INCORRECT;
        }
        if (correctAnswer == null) {
            correctAnswer = "";
        }
    }

    public static AnswerJudgment failed(String error) {
        return new AnswerJudgment(Score.INCORRECT, "", null, error);
    }

    public boolean isCorrect() {
        return score == Score.FULL_MARKS;
    }

    public boolean isFailed() {
        return error != null;
    }
}
