package uk.gegc.revisionhelper.features.revision.domain.model;

import java.util.List;

/**
 * A generated question belonging to one run. Multiple-choice questions carry their
 * options, the zero-based index of the correct one and a rationale.
 */
public record Question(
        String id,
        String runId,
        int ordinal,
        String text,
        QuestionStyle style,
        List<String> options,
        Integer correctAnswerIndex,
        String rationale
) {
    public Question {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Question text must not be blank");
        }
        options = options == null ? List.of() : List.copyOf(options);
        if (style == null) {
            style = options.isEmpty() ? QuestionStyle.FREE_TEXT : QuestionStyle.MULTIPLE_CHOICE;
        }
        if (correctAnswerIndex != null && (correctAnswerIndex < 0 || correctAnswerIndex >= options.size())) {
            throw new IllegalArgumentException(
                    "Correct answer index " + correctAnswerIndex + " is outside " + options.size() + " options");
        }
    }

    public static String idFor(String runId, int ordinal) {
        return runId + "-q" + ordinal;
    }

    public static Question freeText(String runId, int ordinal, String text) {
        return new Question(idFor(runId, ordinal), runId, ordinal, text, QuestionStyle.FREE_TEXT,
                List.of(), null, null);
    }

    public static Question multipleChoice(String runId, int ordinal, String text, List<String> options,
                                          int correctAnswerIndex, String rationale) {
        return new Question(idFor(runId, ordinal), runId, ordinal, text, QuestionStyle.MULTIPLE_CHOICE,
                options, correctAnswerIndex, rationale);
    }

    public boolean isMultipleChoice() {
        return style == QuestionStyle.MULTIPLE_CHOICE;
    }

    public String correctOption() {
        return correctAnswerIndex == null ? null : options.get(correctAnswerIndex);
    }
}
