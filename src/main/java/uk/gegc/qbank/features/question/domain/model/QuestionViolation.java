package uk.gegc.qbank.features.question.domain.model;

/**
 * @param kind    failure category
 * @param field   offending field in wire naming, e.g. {@code text} or {@code choices[2]}
 * @param message human-readable detail
 */
public record QuestionViolation(ViolationKind kind, String field, String message) {
}
