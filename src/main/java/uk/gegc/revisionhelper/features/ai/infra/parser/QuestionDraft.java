package uk.gegc.revisionhelper.features.ai.infra.parser;

import java.util.List;

/**
 * A multiple-choice question recovered by a format, before it is given an id and ordinal.
 */
record QuestionDraft(String text, List<String> options, int correctAnswerIndex, String rationale) {
}
