package uk.gegc.qbank.features.export.domain.model;

public enum ExportIssueCode {
    CORRUPT_ARCHIVE(IssueSeverity.FATAL),
    MISSING_ENTRY(IssueSeverity.FATAL),
    MALFORMED_XML(IssueSeverity.FATAL),
    MALFORMED_CSV(IssueSeverity.FATAL),
    MISSING_ITEM(IssueSeverity.WARNING),
    MISSING_MANIFEST_ENTRY(IssueSeverity.WARNING),
    CORRECT_MARKER_COUNT(IssueSeverity.WARNING),
    ROW_COUNT_MISMATCH(IssueSeverity.WARNING),
    MISSING_ID_COLUMN(IssueSeverity.WARNING);

    private final IssueSeverity severity;

    ExportIssueCode(IssueSeverity severity) {
        this.severity = severity;
    }

    public IssueSeverity severity() {
        return severity;
    }
}
