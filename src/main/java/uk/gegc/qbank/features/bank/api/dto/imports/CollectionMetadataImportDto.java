package uk.gegc.qbank.features.bank.api.dto.imports;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CollectionMetadataImportDto(
        @JsonProperty("subject") String subject,
        @JsonProperty("format_version") String formatVersion,
        @JsonProperty("created_date") String createdDate
) {
}
