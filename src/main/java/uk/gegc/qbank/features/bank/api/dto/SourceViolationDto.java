package uk.gegc.qbank.features.bank.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;

@Schema(name = "SourceViolationDto", description = "One rule a question breaks, located by upload and position")
public record SourceViolationDto(
        @Schema(description = "Zero-based index of the uploaded file", example = "0")
        int sourceIndex,

        @Schema(description = "Zero-based position of the question inside its file", example = "3")
        int position,

        @Schema(description = "Question id as authored", example = "Q4")
        String questionId,

        @Schema(description = "Violation category", example = "CORRECT_ANSWER_NOT_IN_CHOICES")
        ViolationKind kind,

        @Schema(description = "Offending field", example = "correct_answer")
        String field,

        @Schema(description = "Human-readable detail")
        String message
) {
}
