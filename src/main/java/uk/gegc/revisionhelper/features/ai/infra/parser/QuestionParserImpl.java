package uk.gegc.revisionhelper.features.ai.infra.parser;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.revisionhelper.features.revision.domain.model.Question;
import uk.gegc.revisionhelper.features.revision.domain.model.QuestionStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Implementation of QuestionParser. Multiple-choice formats are tried in order and the
 * first one that yields anything wins for the whole response.
 */
@Component
@Slf4j
public class QuestionParserImpl implements QuestionParser {

    private static final Pattern BULLET_PREFIX = Pattern.compile("^[\\s\\-*•]+");

    private final List<MultipleChoiceFormat> formats;

    public QuestionParserImpl() {
        this(List.of(new StructuredTextQuestionFormat(), new JsonArrayQuestionFormat()));
    }

    QuestionParserImpl(List<MultipleChoiceFormat> formats) {
        this.formats = List.copyOf(formats);
    }

    @Override
    public List<Question> parse(String rawText, String runId, int desiredCount, QuestionStyle style) {
        return style == QuestionStyle.MULTIPLE_CHOICE
                ? parseMultipleChoice(rawText, runId, desiredCount)
                : parseFreeText(rawText, runId, desiredCount);
    }

    @Override
    public List<Question> parseMultipleChoice(String rawText, String runId, int desiredCount) {
        if (rawText == null || rawText.isBlank() || desiredCount <= 0) {
            return List.of();
        }

        for (MultipleChoiceFormat format : formats) {
            List<QuestionDraft> drafts;
            try {
                drafts = format.extract(rawText);
            } catch (RuntimeException e) {
                log.warn("Format {} failed on response for run {}: {}", format.name(), runId, e.getMessage());
                continue;
            }
            if (drafts.isEmpty()) {
                continue;
            }

            List<Question> questions = new ArrayList<>();
            for (QuestionDraft draft : drafts) {
                if (questions.size() >= desiredCount) {
                    break;
                }
                int ordinal = questions.size() + 1;
                questions.add(Question.multipleChoice(runId, ordinal, draft.text(), draft.options(),
                        draft.correctAnswerIndex(), draft.rationale()));
            }
            log.debug("Parsed {} multiple-choice questions for run {} using {} format",
                    questions.size(), runId, format.name());
            return List.copyOf(questions);
        }

        log.warn("No multiple-choice questions could be parsed for run {}", runId);
        return List.of();
    }

    @Override
    public List<Question> parseFreeText(String rawText, String runId, int desiredCount) {
        if (rawText == null || rawText.isBlank() || desiredCount <= 0) {
            return List.of();
        }

        List<Question> questions = new ArrayList<>();
        for (String line : rawText.split("\\R")) {
            if (questions.size() >= desiredCount) {
                break;
            }
            String text = BULLET_PREFIX.matcher(line).replaceFirst("").strip();
            if (text.isEmpty()) {
                continue;
            }
            questions.add(Question.freeText(runId, questions.size() + 1, text));
        }
        log.debug("Parsed {} free-text questions for run {}", questions.size(), runId);
        return List.copyOf(questions);
    }
}
