package uk.gegc.qbank.features.bank.application.io.impl;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.bank.api.dto.imports.CollectionMetadataImportDto;
import uk.gegc.qbank.features.bank.api.dto.imports.QuestionImportDto;
import uk.gegc.qbank.features.bank.application.io.QuestionBankReader;
import uk.gegc.qbank.features.bank.infra.mapping.QuestionImportMapper;
import uk.gegc.qbank.features.question.domain.model.CollectionMetadata;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.shared.exception.StructuralException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JsonQuestionBankReader implements QuestionBankReader {

    private final ObjectMapper objectMapper;
    private final QuestionImportMapper importMapper;

    @Override
    public QuestionCollection read(InputStream input) {
        if (input == null) {
            throw new IllegalArgumentException("Question bank input stream is required");
        }

        try (JsonParser parser = objectMapper.getFactory().createParser(input)) {
            JsonToken token = parser.nextToken();
            if (token != JsonToken.START_OBJECT) {
                throw new StructuralException("Question bank must be a JSON object with a 'questions' array");
            }
            return parseBank(parser);
        } catch (StructuralException ex) {
            throw ex;
        } catch (IOException ex) {
            throw new StructuralException("Malformed JSON question bank", ex);
        }
    }

    private QuestionCollection parseBank(JsonParser parser) throws IOException {
        List<Question> questions = null;
        CollectionMetadata metadata = CollectionMetadata.empty();

        while (parser.nextToken() != JsonToken.END_OBJECT) {
            String fieldName = parser.currentName();
            if (fieldName == null) {
                parser.skipChildren();
                continue;
            }
            parser.nextToken();
            switch (fieldName) {
                case "questions" -> {
                    if (parser.currentToken() != JsonToken.START_ARRAY) {
                        throw new StructuralException("Expected 'questions' to be an array");
                    }
                    questions = parseQuestions(parser);
                }
                case "metadata" -> {
                    if (parser.currentToken() == JsonToken.START_OBJECT) {
                        metadata = importMapper.toDomain(
                                objectMapper.readValue(parser, CollectionMetadataImportDto.class));
                    } else {
                        parser.skipChildren();
                    }
                }
                default -> parser.skipChildren();
            }
        }

        if (questions == null) {
            throw new StructuralException("Question bank has no 'questions' array");
        }
        log.debug("Read question bank: questions={}, subject={}", questions.size(), metadata.subject());
        return new QuestionCollection(questions, metadata);
    }

    private List<Question> parseQuestions(JsonParser parser) throws IOException {
        // numeric answers keep every digit the author wrote
        ObjectReader questionReader = objectMapper.readerFor(QuestionImportDto.class)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        List<Question> questions = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
            if (parser.currentToken() != JsonToken.START_OBJECT) {
                throw new StructuralException("Question at position " + questions.size() + " must be a JSON object");
            }
            QuestionImportDto dto = questionReader.readValue(parser);
            questions.add(importMapper.toDomain(dto));
        }
        return questions;
    }
}
