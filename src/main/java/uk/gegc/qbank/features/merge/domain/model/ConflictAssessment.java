package uk.gegc.qbank.features.merge.domain.model;

/**
 * How alike a renamed question is to the earlier question that kept the id, judged by stem similarity.
 */
public enum ConflictAssessment {
    /** Stems are almost identical; probably the same question shipped twice. */
    LIKELY_SAME,
    SIMILAR,
    /** Unrelated questions that happen to share an id. */
    DIFFERENT;

    public static ConflictAssessment of(double similarity) {
        if (similarity > 0.9) {
            return LIKELY_SAME;
        }
        if (similarity > 0.7) {
            return SIMILAR;
        }
        return DIFFERENT;
    }
}
