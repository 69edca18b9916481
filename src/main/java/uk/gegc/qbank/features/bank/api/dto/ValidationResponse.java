package uk.gegc.qbank.features.bank.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ValidationResponse", description = "Validation outcome for every uploaded question bank")
public record ValidationResponse(
        @Schema(description = "Number of uploaded files", example = "2")
        int sourceCount,

        @Schema(description = "Number of questions checked across all files", example = "40")
        int questionCount,

        @Schema(description = "True when no question breaks any rule", example = "false")
        boolean valid,

        @Schema(description = "Every violation found, in upload and question order")
        List<SourceViolationDto> violations
) {
}
