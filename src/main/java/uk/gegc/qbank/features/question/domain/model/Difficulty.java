package uk.gegc.qbank.features.question.domain.model;

import java.util.Arrays;
import java.util.Optional;

public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Labels are matched exactly; "easy" is not a valid difficulty.
     */
    public static Optional<Difficulty> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(d -> d.label.equals(label))
                .findFirst();
    }
}
