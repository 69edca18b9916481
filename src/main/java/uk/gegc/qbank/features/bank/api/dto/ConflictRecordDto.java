package uk.gegc.qbank.features.bank.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qbank.features.merge.domain.model.ConflictAssessment;

@Schema(name = "ConflictRecordDto", description = "A question renamed to resolve an id collision")
public record ConflictRecordDto(
        @Schema(description = "Zero-based index of the uploaded file", example = "1")
        int sourceIndex,

        @Schema(description = "Zero-based position of the question inside its file", example = "0")
        int position,

        @Schema(description = "Id as authored", example = "Q1")
        String originalId,

        @Schema(description = "Id in the merged bank", example = "Q1_1")
        String finalId,

        @Schema(description = "Word-set similarity to the question that kept the id", example = "0.95")
        double similarity,

        @Schema(description = "Whether the two questions look like the same one", example = "LIKELY_SAME")
        ConflictAssessment assessment
) {
}
