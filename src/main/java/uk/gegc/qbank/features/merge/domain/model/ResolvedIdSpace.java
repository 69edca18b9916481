package uk.gegc.qbank.features.merge.domain.model;

import java.util.List;

/**
 * Collision-free ids for every input question, indexed as {@code finalIds.get(source).get(position)}.
 */
public record ResolvedIdSpace(List<List<String>> finalIds, List<ConflictRecord> conflicts) {

    public ResolvedIdSpace {
        finalIds = finalIds.stream().map(List::copyOf).toList();
        conflicts = List.copyOf(conflicts);
    }

    public String finalId(int sourceIndex, int position) {
        return finalIds.get(sourceIndex).get(position);
    }
}
