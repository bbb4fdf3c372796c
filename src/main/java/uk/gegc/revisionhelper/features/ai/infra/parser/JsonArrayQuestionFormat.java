package uk.gegc.revisionhelper.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Fallback for models that answer with JSON instead of the line format:
 * <pre>
 * [{"question": "...", "options": ["3", "4"], "correct": "B", "rationale": "..."}]
 * </pre>
 * A wrapping {@code {"questions": [...]}} object and a markdown fence are tolerated.
 */
@Slf4j
class JsonArrayQuestionFormat implements MultipleChoiceFormat {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public String name() {
        return "json-array";
    }

    @Override
    public List<QuestionDraft> extract(String rawText) {
        JsonNode root;
        try {
            root = objectMapper.readTree(MarkdownFence.strip(rawText));
        } catch (JsonProcessingException e) {
            log.debug("Response is not JSON: {}", e.getOriginalMessage());
            return List.of();
        }

        JsonNode questionsNode = root;
        if (root != null && root.isObject() && root.has("questions")) {
            questionsNode = root.get("questions");
        }
        if (questionsNode == null || !questionsNode.isArray()) {
            return List.of();
        }

        List<QuestionDraft> drafts = new ArrayList<>();
        for (JsonNode questionNode : questionsNode) {
            QuestionDraft draft = parseQuestionNode(questionNode);
            if (draft != null) {
                drafts.add(draft);
            }
        }
        return drafts;
    }

    private QuestionDraft parseQuestionNode(JsonNode questionNode) {
        if (!questionNode.isObject()) {
            return null;
        }
        String questionText = text(questionNode, "question");
        JsonNode optionsNode = questionNode.get("options");
        if (questionText.isEmpty() || optionsNode == null || !optionsNode.isArray() || optionsNode.isEmpty()) {
            log.debug("Skipping JSON question without question text or options");
            return null;
        }

        List<String> options = new ArrayList<>();
        for (JsonNode option : optionsNode) {
            options.add(option.asText().strip());
        }

        int correctIndex = OptionLetters.indexOf(text(questionNode, "correct"));
        if (correctIndex < 0 || correctIndex >= options.size()) {
            log.debug("Skipping JSON question '{}' with unusable correct letter", questionText);
            return null;
        }

        String rationale = text(questionNode, "rationale");
        if (rationale.isEmpty()) {
            rationale = text(questionNode, "explanation");
        }
        if (rationale.isEmpty()) {
            rationale = OptionLetters.DEFAULT_RATIONALE;
        }
        return new QuestionDraft(questionText, options, correctIndex, rationale);
    }

    private String text(JsonNode node, String fieldName) {
        JsonNode field = node.get(fieldName);
        if (field == null || field.isNull() || field.isContainerNode()) {
            return "";
        }
        return field.asText().strip();
    }
}
