package uk.gegc.qbank.features.export.domain.model;

import java.util.List;

/**
 * Renderer output: the file plus the questions that were left out of it.
 */
public record RenderedPackage(ExportFile file, List<PackagingFailure> failures) {

    public RenderedPackage {
        if (file == null) {
            throw new IllegalArgumentException("File cannot be null");
        }
        failures = failures == null ? List.of() : List.copyOf(failures);
    }
}
