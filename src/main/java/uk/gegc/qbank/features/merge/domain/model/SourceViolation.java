package uk.gegc.qbank.features.merge.domain.model;

import uk.gegc.qbank.features.question.domain.model.ViolationKind;

/**
 * A question violation located within a multi-source input.
 */
public record SourceViolation(
        int sourceIndex,
        int position,
        String questionId,
        ViolationKind kind,
        String field,
        String message
) {
}
