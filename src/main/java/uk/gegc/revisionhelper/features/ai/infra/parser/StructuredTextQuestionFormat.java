package uk.gegc.revisionhelper.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the line-prefixed format the generation prompt asks for:
 * <pre>
 * QUESTION: What is 2 + 2?
 * A) 3
 * B) 4
 * CORRECT: B
 * RATIONALE: Two plus two equals four.
 * </pre>
 * Every {@code QUESTION:} line opens a new block. Only options A-D are read; a block whose
 * correct letter does not name one of its parsed options is dropped.
 */
@Slf4j
class StructuredTextQuestionFormat implements MultipleChoiceFormat {

    private static final Pattern QUESTION_LINE = Pattern.compile("^QUESTION:\\s*(.*)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern OPTION_LINE = Pattern.compile("^([A-Za-z])\\)\\s*(.*)$");
    private static final Pattern CORRECT_LINE = Pattern.compile("^CORRECT:\\s*\\(?([A-Za-z]?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RATIONALE_LINE = Pattern.compile("^(?:RATIONALE|EXPLANATION):\\s*(.*)$", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "structured-text";
    }

    @Override
    public List<QuestionDraft> extract(String rawText) {
        List<QuestionDraft> drafts = new ArrayList<>();
        for (List<String> block : splitBlocks(rawText)) {
            QuestionDraft draft = parseBlock(block);
            if (draft != null) {
                drafts.add(draft);
            }
        }
        return drafts;
    }

    private List<List<String>> splitBlocks(String rawText) {
        List<List<String>> blocks = new ArrayList<>();
        List<String> current = null;
        for (String rawLine : rawText.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }
            if (QUESTION_LINE.matcher(line).matches()) {
                current = new ArrayList<>();
                blocks.add(current);
            }
            if (current != null) {
                current.add(line);
            }
        }
        return blocks;
    }

    private QuestionDraft parseBlock(List<String> block) {
        String questionText = null;
        List<Character> letters = new ArrayList<>();
        List<String> options = new ArrayList<>();
        String correctLetter = null;
        StringBuilder rationale = null;
        boolean inRationale = false;

        for (String line : block) {
            Matcher question = QUESTION_LINE.matcher(line);
            if (question.matches()) {
                questionText = question.group(1).strip();
                inRationale = false;
                continue;
            }
            Matcher option = OPTION_LINE.matcher(line);
            if (option.matches()) {
                char letter = Character.toUpperCase(option.group(1).charAt(0));
                boolean newOption = OptionLetters.isValidLetter(letter) && !letters.contains(letter);
                if (inRationale && !newOption) {
                    appendLine(rationale, line);
                    continue;
                }
                inRationale = false;
                // E) and beyond are not options
                if (newOption) {
                    letters.add(letter);
                    options.add(option.group(2).strip());
                }
                continue;
            }
            Matcher correct = CORRECT_LINE.matcher(line);
            if (correct.find()) {
                inRationale = false;
                String letter = correct.group(1);
                correctLetter = letter.isEmpty() ? null : letter.toUpperCase();
                continue;
            }
            Matcher rationaleStart = RATIONALE_LINE.matcher(line);
            if (rationaleStart.matches()) {
                rationale = new StringBuilder(rationaleStart.group(1).strip());
                inRationale = true;
                continue;
            }
            if (inRationale) {
                appendLine(rationale, line);
            }
        }

        if (questionText == null || questionText.isEmpty()) {
            log.debug("Discarding block without question text");
            return null;
        }
        if (options.isEmpty()) {
            log.debug("Discarding block '{}' without options", questionText);
            return null;
        }
        if (correctLetter == null) {
            log.debug("Discarding block '{}' without a correct letter", questionText);
            return null;
        }
        int correctIndex = letters.indexOf(correctLetter.charAt(0));
        if (correctIndex < 0) {
            log.debug("Discarding block '{}': correct letter {} matches none of {}", questionText, correctLetter, letters);
            return null;
        }

        String rationaleText = rationale == null ? "" : rationale.toString().strip();
        if (rationaleText.isEmpty()) {
            rationaleText = OptionLetters.DEFAULT_RATIONALE;
        }
        return new QuestionDraft(questionText, options, correctIndex, rationaleText);
    }

    private static void appendLine(StringBuilder rationale, String line) {
        if (rationale.length() > 0) {
            rationale.append('\n');
        }
        rationale.append(line);
    }
}
