package uk.gegc.qbank.shared.exception;

import uk.gegc.qbank.features.export.domain.model.ExportIssue;

import java.util.List;

/**
 * A built package failed its integrity check with at least one fatal issue.
 */
public class ExportIntegrityException extends RuntimeException {

    private final List<ExportIssue> issues;

    public ExportIntegrityException(List<ExportIssue> issues) {
        super("Built package failed integrity check: " + issues.stream()
                .filter(ExportIssue::isFatal)
                .map(issue -> issue.code() + " " + issue.message())
                .toList());
        this.issues = List.copyOf(issues);
    }

    public List<ExportIssue> getIssues() {
        return issues;
    }
}
