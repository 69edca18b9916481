package uk.gegc.qbank.features.merge.domain.model;

/**
 * Audit entry for one renamed question.
 *
 * @param sourceIndex zero-based index of the input collection
 * @param position    zero-based position of the question inside that collection
 * @param originalId  id as authored
 * @param finalId     id in the merged collection
 * @param similarity  stem similarity to the question that kept {@code originalId}
 * @param assessment  reading of {@code similarity}
 */
public record ConflictRecord(
        int sourceIndex,
        int position,
        String originalId,
        String finalId,
        double similarity,
        ConflictAssessment assessment
) {
}
