package uk.gegc.revisionhelper.features.ai.infra.parser;

import java.util.List;

/**
 * One way of reading multiple-choice questions out of model text.
 * An empty result means the format did not recognise anything.
 */
interface MultipleChoiceFormat {

    String name();

    List<QuestionDraft> extract(String rawText);
}
