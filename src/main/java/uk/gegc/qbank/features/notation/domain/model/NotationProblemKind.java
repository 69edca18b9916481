package uk.gegc.qbank.features.notation.domain.model;

public enum NotationProblemKind {
    /** A {@code $} or {@code $$} opener without its closer. */
    DELIMITER_IMBALANCE,
    /** A single {@code $} inside a display span. */
    NESTED_DELIMITER,
    /** A math span with no content, e.g. {@code $$$$} or {@code $ $}. */
    EMPTY_MATH_SPAN,
    /** {@code \(}, {@code \)}, {@code \[} or {@code \]} written directly by the author. */
    TARGET_DIALECT_PRESENT;

    /**
     * Whether text carrying this problem cannot be converted to a target dialect.
     */
    public boolean blocksTransform() {
        return this != TARGET_DIALECT_PRESENT;
    }
}
