package uk.gegc.qbank.features.export.infra;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static uk.gegc.qbank.features.export.infra.CsvQuestionColumns.*;

/**
 * Reads a CSV package back into rows keyed by header name, or into questions.
 */
@Component
public class CsvQuestionTableReader {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    /**
     * @throws IOException if the content is not parseable CSV with a header row
     */
    public List<Map<String, String>> readRows(byte[] content) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> rows = CSV_MAPPER
                .readerFor(Map.class)
                .with(schema)
                .readValues(content)) {
            return rows.readAll();
        }
    }

    /**
     * Rebuilds questions from a CSV package. Values are taken as written, already in the target math dialect.
     */
    public List<Question> readQuestions(byte[] content) throws IOException {
        List<Question> questions = new ArrayList<>();
        for (Map<String, String> row : readRows(content)) {
            questions.add(toQuestion(row));
        }
        return questions;
    }

    private Question toQuestion(Map<String, String> row) {
        List<String> choices = new ArrayList<>();
        for (int i = 0; row.containsKey(choiceColumn(i)); i++) {
            String choice = row.get(choiceColumn(i));
            if (choice != null && !choice.isEmpty()) {
                choices.add(choice);
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        putIfPresent(metadata, Question.TOPIC, row.get(TOPIC));
        putIfPresent(metadata, Question.SUBTOPIC, row.get(SUBTOPIC));
        putIfPresent(metadata, Question.DIFFICULTY, row.get(DIFFICULTY));

        return Question.builder()
                .id(emptyToNull(row.get(ID)))
                .type(QuestionType.fromValue(row.get(TYPE)).orElse(null))
                .text(emptyToNull(row.get(TEXT)))
                .choices(choices)
                .correctAnswer(emptyToNull(row.get(CORRECT_ANSWER)))
                .tolerance(parseDouble(row.get(TOLERANCE)))
                .points(parseDouble(row.get(POINTS)))
                .feedbackCorrect(emptyToNull(row.get(FEEDBACK_CORRECT)))
                .feedbackIncorrect(emptyToNull(row.get(FEEDBACK_INCORRECT)))
                .metadata(metadata)
                .build();
    }

    private static void putIfPresent(Map<String, Object> metadata, String key, String value) {
        if (value != null && !value.isEmpty()) {
            metadata.put(key, value);
        }
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static Double parseDouble(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
