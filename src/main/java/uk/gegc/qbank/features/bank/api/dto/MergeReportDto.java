package uk.gegc.qbank.features.bank.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "MergeReportDto", description = "Audit of a merge")
public record MergeReportDto(
        @Schema(description = "Number of merged files", example = "2")
        int sourceCount,

        @Schema(description = "Questions read across all files", example = "3")
        int totalIn,

        @Schema(description = "Questions in the merged bank; always equal to totalIn", example = "3")
        int totalOut,

        @Schema(description = "Number of renamed questions", example = "1")
        int collisionCount,

        List<ConflictRecordDto> conflicts,

        @Schema(description = "Advisory near-duplicates; both questions are kept")
        List<DuplicateCandidateDto> duplicateCandidates
) {
}
