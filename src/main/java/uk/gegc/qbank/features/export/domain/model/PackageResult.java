package uk.gegc.qbank.features.export.domain.model;

import java.util.List;

/**
 * A built and checked package.
 *
 * @param failures questions skipped by the renderer (CSV only)
 * @param issues   advisory integrity issues; never fatal ones
 */
public record PackageResult(ExportFile file, List<PackagingFailure> failures, List<ExportIssue> issues) {

    public PackageResult {
        failures = failures == null ? List.of() : List.copyOf(failures);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
