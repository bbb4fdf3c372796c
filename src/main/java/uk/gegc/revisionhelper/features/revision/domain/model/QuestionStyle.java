package uk.gegc.revisionhelper.features.revision.domain.model;

import java.util.Arrays;

public enum QuestionStyle {
    FREE_TEXT("free-text"),
    MULTIPLE_CHOICE("multiple-choice");

    private final String label;

    QuestionStyle(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Unknown or missing labels fall back to free text.
     */
    public static QuestionStyle fromLabel(String label) {
        if (label == null) {
            return FREE_TEXT;
        }
        String normalized = label.trim();
        return Arrays.stream(values())
                .filter(style -> style.label.equalsIgnoreCase(normalized) || style.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElse(FREE_TEXT);
    }
}
