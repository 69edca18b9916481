package uk.gegc.qbank.features.question.domain.model;

/**
 * Machine-readable category of a question validation failure.
 */
public enum ViolationKind {
    MISSING_ID,
    MISSING_TEXT,
    UNRECOGNIZED_TYPE,
    MISSING_CHOICES,
    BLANK_CHOICE,
    CORRECT_ANSWER_NOT_IN_CHOICES,
    NON_NUMERIC_ANSWER,
    INVALID_BOOLEAN_ANSWER,
    MISSING_CORRECT_ANSWER,
    DELIMITER_IMBALANCE,
    NESTED_DELIMITER,
    EMPTY_MATH_SPAN,
    TARGET_DIALECT_PRESENT,
    NON_POSITIVE_POINTS,
    NEGATIVE_TOLERANCE,
    INVALID_DIFFICULTY,
    TEXT_TOO_LONG
}
