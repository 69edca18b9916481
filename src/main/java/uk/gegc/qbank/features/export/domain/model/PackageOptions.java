package uk.gegc.qbank.features.export.domain.model;

import lombok.Builder;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;

/**
 * Caller choices for a package build. Any null field falls back to the configured default.
 */
@Builder
public record PackageOptions(String title, String filename, TargetDialect dialect) {

    public static PackageOptions defaults() {
        return new PackageOptions(null, null, null);
    }
}
