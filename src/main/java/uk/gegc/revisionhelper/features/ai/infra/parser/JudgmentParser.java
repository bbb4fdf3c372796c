package uk.gegc.revisionhelper.features.ai.infra.parser;

import uk.gegc.revisionhelper.features.ai.domain.model.AnswerJudgment;

/**
 * Parser for converting a marking response into an {@link AnswerJudgment}
 */
public interface JudgmentParser {

    /**
     * Parse a marking response. Never throws: when no JSON object can be recovered the
     * returned judgment is {@link AnswerJudgment#isFailed() failed}.
     *
     * @param rawText The raw response from the model
     * @return The judgment, or a failed judgment describing why none could be read
     */
    AnswerJudgment parse(String rawText);
}
