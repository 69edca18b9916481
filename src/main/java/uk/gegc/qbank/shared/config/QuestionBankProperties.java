package uk.gegc.qbank.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;

/**
 * Type-safe configuration for validation limits, merging and packaging defaults.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "qbank")
public class QuestionBankProperties {

    @Valid
    private Validation validation = new Validation();

    @Valid
    private Merge merge = new Merge();

    @Valid
    private Export export = new Export();

    @Data
    public static class Validation {

        @NotNull(message = "Property qbank.validation.max-text-length must be configured")
        @Min(value = 1, message = "qbank.validation.max-text-length must be at least 1")
        private Integer maxTextLength = 2000;
    }

    @Data
    public static class Merge {

        /**
         * Word-level Jaccard similarity at which two stems from different sources are reported as likely duplicates.
         */
        @NotNull(message = "Property qbank.merge.duplicate-similarity-threshold must be configured")
        @DecimalMin(value = "0.0", message = "qbank.merge.duplicate-similarity-threshold must be at least 0")
        @DecimalMax(value = "1.0", message = "qbank.merge.duplicate-similarity-threshold must be at most 1")
        private Double duplicateSimilarityThreshold = 0.8;

        @NotNull(message = "Property qbank.merge.max-sources must be configured")
        @Min(value = 1, message = "qbank.merge.max-sources must be at least 1")
        private Integer maxSources = 20;
    }

    @Data
    public static class Export {

        @NotNull(message = "Property qbank.export.default-dialect must be configured")
        private TargetDialect defaultDialect = TargetDialect.CANVAS;

        @NotBlank(message = "Property qbank.export.default-title must be configured")
        private String defaultTitle = "Question Bank";

        @NotNull(message = "Property qbank.export.max-filename-length must be configured")
        @Min(value = 16, message = "qbank.export.max-filename-length must be at least 16")
        private Integer maxFilenameLength = 100;
    }
}
