package uk.gegc.qbank.features.merge.domain.model;

import java.util.List;

/**
 * Two questions from different sources whose stems look alike. Advisory only; both are kept.
 * Ids are the final, post-resolution ids.
 *
 * @param metadataDifferences names of the fields set on both questions with different values,
 *                            drawn from type, points, topic, subtopic and difficulty
 */
public record DuplicateCandidate(
        int firstSourceIndex,
        String firstId,
        int secondSourceIndex,
        String secondId,
        double similarity,
        List<String> metadataDifferences
) {
    public DuplicateCandidate {
        metadataDifferences = metadataDifferences == null ? List.of() : List.copyOf(metadataDifferences);
    }
}
