package uk.gegc.revisionhelper.features.revision.domain.model;

import uk.gegc.revisionhelper.features.ai.domain.model.AnswerJudgment;

/**
 * Submission payload for an answer; the id, question text and timestamp are filled in on store.
 */
public record NewAnswer(
        String questionId,
        String studentAnswer,
        Score score,
        String correctAnswer,
        String explanation,
        String error
) {
    public static NewAnswer from(String questionId, String studentAnswer, AnswerJudgment judgment) {
        return new NewAnswer(
                questionId,
                studentAnswer,
                judgment.score(),
                judgment.correctAnswer(),
                judgment.explanation(),
                judgment.error()
        );
    }
}
