package uk.gegc.revisionhelper.features.ai.infra.parser;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.revisionhelper.features.ai.domain.model.AnswerJudgment;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;
import uk.gegc.revisionhelper.shared.exception.AIResponseParseException;

/**
 * Reads {@code score}, {@code correct_answer} and {@code explanation} from a marking response.
 * <p>
 * A missing or unknown {@code score} is inferred from the legacy {@code is_correct} flag, which
 * can only produce Full Marks or Incorrect. Whatever correctness flag the payload carries, the
 * judgment's correctness is always derived from the score.
 */
@Component
@Slf4j
public class JudgmentParserImpl implements JudgmentParser {

    private final JsonObjectExtractor extractor = new JsonObjectExtractor();

    @Override
    public AnswerJudgment parse(String rawText) {
        JsonNode node;
        try {
            node = extractor.extract(MarkdownFence.strip(rawText));
        } catch (AIResponseParseException e) {
            log.warn("Failed to parse marking response: {}", e.getMessage());
            return AnswerJudgment.failed("Failed to parse marking response: " + e.getMessage());
        }

        Score score = readScore(node);
        String correctAnswer = readText(node, "correct_answer");
        String explanation = readText(node, "explanation");
        if (explanation.isBlank()) {
            explanation = defaultExplanation(score, correctAnswer);
        }

        log.debug("Parsed judgment: score={}, correctAnswer={}", score.label(), correctAnswer);
        return new AnswerJudgment(score, correctAnswer, explanation, null);
    }

    private Score readScore(JsonNode node) {
        JsonNode scoreNode = node.get("score");
        if (scoreNode != null && scoreNode.isTextual()) {
            var parsed = Score.fromLabel(scoreNode.asText());
            if (parsed.isPresent()) {
                return parsed.get();
            }
            log.debug("Ignoring unknown score label '{}'", scoreNode.asText());
        }
        // The legacy flag has no partial tier.
        JsonNode isCorrect = node.get("is_correct");
        return isCorrect != null && isCorrect.asBoolean(false) ? Score.FULL_MARKS : Score.INCORRECT;
    }

    private String readText(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || field.isNull()) {
            return "";
        }
        return field.isTextual() ? field.asText() : field.toString();
    }

    static String defaultExplanation(Score score, String correctAnswer) {
        return switch (score) {
            case FULL_MARKS -> "Your answer is completely correct! The correct answer is: " + correctAnswer + ".";
            case PARTIAL_MARKS -> "Your answer is partially correct. The complete answer is: " + correctAnswer
                    + ". Review the parts you missed and try again.";
            case INCORRECT -> "The correct answer is: " + correctAnswer + ". Please review the question and try again.";
        };
    }
}
