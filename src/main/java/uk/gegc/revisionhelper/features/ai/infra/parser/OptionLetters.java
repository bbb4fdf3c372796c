package uk.gegc.revisionhelper.features.ai.infra.parser;

/**
 * Maps answer letters A-D to zero-based option indexes.
 */
final class OptionLetters {

    static final String DEFAULT_RATIONALE = "Correct answer selected.";

    private static final String LETTERS = "ABCD";

    private OptionLetters() {
    }

    /**
     * @return the zero-based index for the letter, or -1 when it is not one of A-D
     */
    static int indexOf(String letter) {
        if (letter == null) {
            return -1;
        }
        String trimmed = letter.trim();
        if (trimmed.isEmpty()) {
            return -1;
        }
        return LETTERS.indexOf(Character.toUpperCase(trimmed.charAt(0)));
    }

    static boolean isValidLetter(char letter) {
        return LETTERS.indexOf(Character.toUpperCase(letter)) >= 0;
    }
}
