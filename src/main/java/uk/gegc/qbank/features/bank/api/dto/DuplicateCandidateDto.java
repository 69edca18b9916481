package uk.gegc.qbank.features.bank.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "DuplicateCandidateDto", description = "Two questions from different files with near-identical text")
public record DuplicateCandidateDto(
        int firstSourceIndex,
        String firstId,
        int secondSourceIndex,
        String secondId,

        @Schema(description = "Word-set similarity between the two stems", example = "0.875")
        double similarity,

        @Schema(description = "Fields set on both questions with different values", example = "[\"points\", \"difficulty\"]")
        List<String> metadataDifferences
) {
}
