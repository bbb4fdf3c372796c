package uk.gegc.revisionhelper.features.revision.domain.model;

import java.util.Optional;

/**
 * Three-tier grade given to a submitted answer.
 */
public enum Score {
    FULL_MARKS("Full Marks", 100.0),
    PARTIAL_MARKS("Partial Marks", 50.0),
    INCORRECT("Incorrect", 0.0);

    private final String label;
    private final double points;

    Score(String label, double points) {
        this.label = label;
        this.points = points;
    }

    public String label() {
        return label;
    }

    public double points() {
        return points;
    }

    /**
     * Exact, case-sensitive match against the tier labels.
     */
    public static Optional<Score> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (Score score : values()) {
            if (score.label.equals(label)) {
                return Optional.of(score);
            }
        }
        return Optional.empty();
    }
}
