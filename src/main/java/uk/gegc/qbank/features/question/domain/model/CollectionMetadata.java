package uk.gegc.qbank.features.question.domain.model;

/**
 * Header of a question bank file.
 */
public record CollectionMetadata(
        String subject,
        String formatVersion,
        String createdDate
) {
    public static CollectionMetadata empty() {
        return new CollectionMetadata(null, null, null);
    }
}
