package uk.gegc.qbank.features.bank.infra.mapping;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.bank.api.dto.imports.CollectionMetadataImportDto;
import uk.gegc.qbank.features.bank.api.dto.imports.QuestionImportDto;
import uk.gegc.qbank.features.question.domain.model.CollectionMetadata;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.shared.util.NumberText;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts parsed bank entries into domain questions. No validation happens here:
 * unknown types become a null type and bad values are kept so the validator can report them.
 */
@Component
public class QuestionImportMapper {

    public Question toDomain(QuestionImportDto dto) {
        if (dto == null) {
            throw new IllegalArgumentException("Question payload is required");
        }

        return Question.builder()
                .id(dto.id())
                .type(QuestionType.fromValue(dto.type()).orElse(null))
                .text(dto.text())
                .choices(dto.choices())
                .correctAnswer(answerAsText(dto.correctAnswer()))
                .tolerance(dto.tolerance())
                .points(dto.points())
                .feedbackCorrect(dto.feedbackCorrect())
                .feedbackIncorrect(dto.feedbackIncorrect())
                .metadata(mergeLegacyMetadata(dto))
                .build();
    }

    public CollectionMetadata toDomain(CollectionMetadataImportDto dto) {
        if (dto == null) {
            return CollectionMetadata.empty();
        }
        return new CollectionMetadata(dto.subject(), dto.formatVersion(), dto.createdDate());
    }

    private String answerAsText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue() ? "True" : "False";
        }
        if (node.isNumber()) {
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                return node.asText();
            }
            return NumberText.plain(node.decimalValue());
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        return node.toString();
    }

    private Map<String, Object> mergeLegacyMetadata(QuestionImportDto dto) {
        Map<String, Object> metadata = dto.metadata() != null
                ? new LinkedHashMap<>(dto.metadata())
                : new LinkedHashMap<>();
        putIfAbsent(metadata, Question.TOPIC, dto.topic());
        putIfAbsent(metadata, Question.SUBTOPIC, dto.subtopic());
        putIfAbsent(metadata, Question.DIFFICULTY, dto.difficulty());
        return metadata;
    }

    private void putIfAbsent(Map<String, Object> metadata, String key, String value) {
        if (value != null && !metadata.containsKey(key)) {
            metadata.put(key, value);
        }
    }
}
