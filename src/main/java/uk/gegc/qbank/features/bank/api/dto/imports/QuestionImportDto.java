package uk.gegc.qbank.features.bank.api.dto.imports;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * One question as it appears in a portable bank file.
 * {@code correct_answer} stays a raw node because authors write it as a string, number or boolean.
 * The top-level {@code topic}, {@code subtopic} and {@code difficulty} keys are the legacy layout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QuestionImportDto(
        @JsonProperty("id") String id,
        @JsonProperty("type") String type,
        @JsonProperty("text") @JsonAlias("question_text") String text,
        @JsonProperty("choices") List<String> choices,
        @JsonProperty("correct_answer") JsonNode correctAnswer,
        @JsonProperty("tolerance") Double tolerance,
        @JsonProperty("points") Double points,
        @JsonProperty("feedback_correct") String feedbackCorrect,
        @JsonProperty("feedback_incorrect") String feedbackIncorrect,
        @JsonProperty("metadata") Map<String, Object> metadata,
        @JsonProperty("topic") String topic,
        @JsonProperty("subtopic") String subtopic,
        @JsonProperty("difficulty") String difficulty
) {
}
