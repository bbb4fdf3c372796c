package uk.gegc.revisionhelper.features.ai.infra.parser;

import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;

import java.util.List;

/**
 * Parser for converting generated text into the questions of a run.
 * Implementations never throw for malformed input; they return what they can recover.
 */
public interface QuestionParser {

    /**
     * Parse questions in the given style
     *
     * @param rawText      The raw response from the model
     * @param runId        Run the questions belong to, used to derive question ids
     * @param desiredCount Upper bound on the number of questions returned
     * @param style        Expected question style
     * @return Parsed questions, possibly empty
     */
    List<Question> parse(String rawText, String runId, int desiredCount, QuestionStyle style);

    /**
     * Parse multiple-choice questions, trying the structured text format first and
     * the JSON array format second.
     */
    List<Question> parseMultipleChoice(String rawText, String runId, int desiredCount);

    /**
     * One question per non-empty line, bullet markers stripped.
     */
    List<Question> parseFreeText(String rawText, String runId, int desiredCount);
}
