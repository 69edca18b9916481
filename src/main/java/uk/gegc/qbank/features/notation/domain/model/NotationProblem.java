package uk.gegc.qbank.features.notation.domain.model;

/**
 * A single finding of the math scanner.
 *
 * @param kind   what is wrong
 * @param offset zero-based character offset of the offending delimiter
 */
public record NotationProblem(NotationProblemKind kind, int offset) {

    public String describe() {
        return switch (kind) {
            case DELIMITER_IMBALANCE -> "Unclosed math delimiter at offset " + offset;
            case NESTED_DELIMITER -> "Inline delimiter nested inside display math at offset " + offset;
            case EMPTY_MATH_SPAN -> "Empty math span at offset " + offset;
            case TARGET_DIALECT_PRESENT -> "LMS math delimiter written directly at offset " + offset;
        };
    }
}
