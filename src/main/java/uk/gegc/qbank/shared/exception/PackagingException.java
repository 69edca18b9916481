package uk.gegc.qbank.shared.exception;

import uk.gegc.qbank.features.export.domain.model.PackagingFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A package could not be built because one or more questions failed to render.
 */
public class PackagingException extends RuntimeException {

    private final List<PackagingFailure> failures;

    public PackagingException(List<PackagingFailure> failures) {
        super("Failed to package question(s): " + failures.stream()
                .map(PackagingFailure::questionId)
                .collect(Collectors.joining(", ")));
        this.failures = List.copyOf(failures);
    }

    public List<PackagingFailure> getFailures() {
        return failures;
    }

    public List<String> getFailedQuestionIds() {
        return failures.stream().map(PackagingFailure::questionId).toList();
    }
}
