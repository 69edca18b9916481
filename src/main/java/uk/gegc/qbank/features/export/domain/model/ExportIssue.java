package uk.gegc.qbank.features.export.domain.model;

/**
 * Finding of the post-build integrity check.
 *
 * @param questionId affected question, or {@code null} for package-level issues
 */
public record ExportIssue(ExportIssueCode code, String questionId, String message) {

    public static ExportIssue of(ExportIssueCode code, String message) {
        return new ExportIssue(code, null, message);
    }

    public IssueSeverity severity() {
        return code.severity();
    }

    public boolean isFatal() {
        return code.severity() == IssueSeverity.FATAL;
    }
}
