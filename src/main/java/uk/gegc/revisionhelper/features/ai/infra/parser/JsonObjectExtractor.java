package uk.gegc.revisionhelper.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import uk.gegc.revisionhelper.shared.exception.AIResponseParseException;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Recovers a JSON object from model text: first the whole text, then the first
 * balanced-brace substring (at most one level of nesting) that parses.
 * <p>
 * Braces are counted character by character from each opening brace, skipping those
 * inside string literals, so the cost of a long field stays linear.
 */
@Slf4j
class JsonObjectExtractor {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private static final int MAX_SCAN_LENGTH = 100_000;
    private static final int MAX_DEPTH = 2;

    private final List<Function<String, Optional<JsonNode>>> strategies =
            List.of(this::readWhole, this::scanForObject);

    JsonNode extract(String text) {
        if (text == null || text.isBlank()) {
            throw new AIResponseParseException("Response is empty");
        }
        for (Function<String, Optional<JsonNode>> strategy : strategies) {
            Optional<JsonNode> node = strategy.apply(text);
            if (node.isPresent()) {
                return node.get();
            }
        }
        throw new AIResponseParseException("No JSON object found in response");
    }

    private Optional<JsonNode> readWhole(String text) {
        return readObject(text);
    }

    private Optional<JsonNode> scanForObject(String text) {
        String scanned = text.length() > MAX_SCAN_LENGTH ? text.substring(0, MAX_SCAN_LENGTH) : text;
        int start = scanned.indexOf('{');
        while (start >= 0) {
            int end = findClosingBrace(scanned, start);
            if (end > start) {
                Optional<JsonNode> node = readObject(scanned.substring(start, end + 1));
                if (node.isPresent()) {
                    log.debug("Recovered JSON object at offset {}", start);
                    return node;
                }
            }
            start = scanned.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    /**
     * @return index of the brace closing the one at {@code start}, or -1 when it is
     * unbalanced or nested deeper than {@link #MAX_DEPTH}
     */
    private int findClosingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
                if (depth > MAX_DEPTH) {
                    return -1;
                }
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private Optional<JsonNode> readObject(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
