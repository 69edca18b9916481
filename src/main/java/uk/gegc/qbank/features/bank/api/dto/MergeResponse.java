package uk.gegc.qbank.features.bank.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "MergeResponse", description = "Merged question bank together with its merge report")
public record MergeResponse(
        @Schema(description = "Merged bank in the portable question bank format")
        JsonNode bank,

        MergeReportDto report
) {
}
