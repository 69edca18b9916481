package uk.gegc.qbank.features.merge.domain.model;

import java.util.List;

public record MergeReport(
        int sourceCount,
        int totalIn,
        int totalOut,
        int collisionCount,
        List<ConflictRecord> conflicts,
        List<DuplicateCandidate> duplicateCandidates
) {
    public MergeReport {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        duplicateCandidates = duplicateCandidates == null ? List.of() : List.copyOf(duplicateCandidates);
    }
}
