package uk.gegc.qbank.features.bank.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;

/**
 * Query parameters of the package export endpoint.
 * Only format is required; the rest fall back to configured defaults.
 */
public record PackageExportRequest(
        @NotNull(message = "Export format is required")
        ExportFormat format,

        TargetDialect dialect,

        @Size(max = 200, message = "Title must not exceed 200 characters")
        String title,

        @Size(max = 255, message = "Filename must not exceed 255 characters")
        String filename
) {
    public PackageOptions toOptions() {
        return PackageOptions.builder()
                .title(title)
                .filename(filename)
                .dialect(dialect)
                .build();
    }
}
