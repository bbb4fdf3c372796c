package uk.gegc.revisionhelper.features.ai.infra.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.parallel.Execution;
import org.junit.jupiter.api.parallel.ExecutionMode;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.revisionhelper.features.ai.domain.model.AnswerJudgment;
import uk.gegc.revisionhelper.features.revision.domain.model.Score;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Execution(ExecutionMode.CONCURRENT)
@DisplayName("JudgmentParserImpl")
class JudgmentParserImplTest {

    private final JudgmentParserImpl parser = new JudgmentParserImpl();

    @Test
    @DisplayName("fills in a completely-correct explanation for a fenced Full Marks response")
    void synthesisesExplanationForFencedFullMarks() {
        String raw = "```json\n{\"score\":\"Full Marks\",\"is_correct\":true,\"correct_answer\":\"4\",\"explanation\":\"\"}\n```";

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.FULL_MARKS, judgment.score());
        assertTrue(judgment.isCorrect());
        assertEquals("4", judgment.correctAnswer());
        assertThat(judgment.explanation()).isNotBlank().contains("completely correct").contains("4");
        assertNull(judgment.error());
    }

    @Test
    @DisplayName("keeps a provided explanation")
    void keepsExplanation() {
        String raw = "{\"score\":\"Incorrect\",\"correct_answer\":\"Paris\",\"explanation\":\"Berlin is in Germany.\"}";

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.INCORRECT, judgment.score());
        assertEquals("Berlin is in Germany.", judgment.explanation());
    }

    @Test
    @DisplayName("derives correctness from the score, not from is_correct")
    void partialMarksIsNeverCorrect() {
        String raw = "{\"score\":\"Partial Marks\",\"is_correct\":true,\"correct_answer\":\"H2O\"}";

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.PARTIAL_MARKS, judgment.score());
        assertFalse(judgment.isCorrect());
        assertThat(judgment.explanation()).contains("partially correct").contains("H2O");
    }

    @Test
    @DisplayName("infers the score from is_correct when the score is missing")
    void infersScoreFromFlag() {
        assertEquals(Score.FULL_MARKS, parser.parse("{\"is_correct\":true,\"correct_answer\":\"4\"}").score());
        assertEquals(Score.INCORRECT, parser.parse("{\"is_correct\":false,\"correct_answer\":\"4\"}").score());
        assertEquals(Score.INCORRECT, parser.parse("{\"correct_answer\":\"4\"}").score());
    }

    @Test
    @DisplayName("falls back to is_correct for an unknown score label")
    void unknownLabelFallsBackToFlag() {
        AnswerJudgment judgment = parser.parse("{\"score\":\"full marks\",\"is_correct\":true}");

        assertEquals(Score.FULL_MARKS, judgment.score());
        assertEquals("", judgment.correctAnswer());
    }

    @Test
    @DisplayName("finds a JSON object embedded in prose")
    void findsEmbeddedObject() {
        String raw = """
                Let me mark this answer.
                {"score": "Partial Marks", "correct_answer": "Mitochondria", "explanation": "Close.", "meta": {"confidence": 0.8}}
                Hope this helps!
                """;

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.PARTIAL_MARKS, judgment.score());
        assertEquals("Mitochondria", judgment.correctAnswer());
        assertEquals("Close.", judgment.explanation());
    }

    @Test
    @DisplayName("finds a prose-wrapped object with a very long explanation")
    void findsEmbeddedObjectWithLongField() {
        String explanation = "x".repeat(20_000);
        String raw = "Here is my marking:\n{\"score\":\"Full Marks\",\"correct_answer\":\"4\",\"explanation\":\""
                + explanation + "\"}";

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.FULL_MARKS, judgment.score());
        assertEquals(20_000, judgment.explanation().length());
        assertNull(judgment.error());
    }

    @Test
    @DisplayName("ignores braces inside string values when scanning prose")
    void ignoresBracesInsideStrings() {
        String raw = "Marking below.\n{\"score\": \"Incorrect\", \"correct_answer\": \"{x}\", "
                + "\"explanation\": \"The closing } was missing.\"} Thanks.";

        AnswerJudgment judgment = parser.parse(raw);

        assertEquals(Score.INCORRECT, judgment.score());
        assertEquals("{x}", judgment.correctAnswer());
        assertEquals("The closing } was missing.", judgment.explanation());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"no json here", "[1, 2, 3]", "{not valid"})
    @DisplayName("returns an error value instead of throwing for unreadable responses")
    void returnsErrorValue(String raw) {
        AnswerJudgment judgment = parser.parse(raw);

        assertTrue(judgment.isFailed());
        assertThat(judgment.error()).startsWith("Failed to parse marking response");
        assertEquals(Score.INCORRECT, judgment.score());
        assertFalse(judgment.isCorrect());
        assertEquals("", judgment.correctAnswer());
        assertNull(judgment.explanation());
    }

    @Test
    @DisplayName("default explanations name the correct answer for every tier")
    void defaultExplanations() {
        assertEquals("Your answer is completely correct! The correct answer is: 4.",
                JudgmentParserImpl.defaultExplanation(Score.FULL_MARKS, "4"));
        assertEquals("Your answer is partially correct. The complete answer is: 4. Review the parts you missed and try again.",
                JudgmentParserImpl.defaultExplanation(Score.PARTIAL_MARKS, "4"));
        assertEquals("The correct answer is: 4. Please review the question and try again.",
                JudgmentParserImpl.defaultExplanation(Score.INCORRECT, "4"));
    }
}
