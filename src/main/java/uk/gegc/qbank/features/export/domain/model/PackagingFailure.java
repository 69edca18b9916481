package uk.gegc.qbank.features.export.domain.model;

/**
 * A question that could not be rendered into the target format.
 */
public record PackagingFailure(int position, String questionId, String reason) {
}
