package uk.gegc.qbank.features.export.application.impl;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.export.application.ExportRenderer;
import uk.gegc.qbank.features.export.application.QuestionNotationPreparer;
import uk.gegc.qbank.features.export.domain.model.ExportFile;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportPayload;
import uk.gegc.qbank.features.export.domain.model.PackagingFailure;
import uk.gegc.qbank.features.export.domain.model.RenderedPackage;
import uk.gegc.qbank.features.export.infra.ExportMediaTypeResolver;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.shared.exception.NotationException;
import uk.gegc.qbank.shared.util.NumberText;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static uk.gegc.qbank.features.export.infra.CsvQuestionColumns.*;

/**
 * Renders one CSV row per question. A question whose math cannot be converted is skipped and reported;
 * the remaining rows are still written.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvExportRenderer implements ExportRenderer {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private final QuestionNotationPreparer notationPreparer;
    private final ExportMediaTypeResolver mediaTypeResolver;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.CSV;
    }

    @Override
    public RenderedPackage render(ExportPayload payload) {
        List<Question> prepared = new ArrayList<>();
        List<PackagingFailure> failures = new ArrayList<>();
        List<Question> questions = payload.collection().questions();
        for (int position = 0; position < questions.size(); position++) {
            Question question = questions.get(position);
            try {
                prepared.add(notationPreparer.prepare(question, payload.dialect()));
            } catch (NotationException e) {
                log.warn("Skipping question in CSV export: id={}, reason={}", question.id(), e.getMessage());
                failures.add(new PackagingFailure(position, question.id(), e.getMessage()));
            }
        }

        int choiceSlots = prepared.stream().mapToInt(q -> q.choices().size()).max().orElse(0);
        CsvSchema schema = schema(choiceSlots);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (SequenceWriter writer = CSV_MAPPER.writer(schema).writeValues(out)) {
            Map<String, String> headerRow = new LinkedHashMap<>();
            header(choiceSlots).forEach(column -> headerRow.put(column, column));
            writer.write(headerRow);
            for (Question question : prepared) {
                writer.write(toRow(question));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render CSV export", e);
        }

        byte[] bytes = out.toByteArray();
        ExportFile file = ExportFile.ofBytes(
                payload.filenameBase() + "." + mediaTypeResolver.fileExtensionFor(ExportFormat.CSV),
                mediaTypeResolver.contentTypeFor(ExportFormat.CSV),
                bytes
        );
        return new RenderedPackage(file, failures);
    }

    private Map<String, String> toRow(Question question) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(ID, question.id());
        row.put(TYPE, question.type() != null ? question.type().value() : null);
        row.put(TEXT, question.text());
        row.put(POINTS, formatNumber(question.points()));
        row.put(TOPIC, question.topic());
        row.put(DIFFICULTY, question.difficulty());
        List<String> choices = question.choices();
        for (int i = 0; i < choices.size(); i++) {
            row.put(choiceColumn(i), choices.get(i));
        }
        row.put(FEEDBACK_CORRECT, question.feedbackCorrect());
        row.put(FEEDBACK_INCORRECT, question.feedbackIncorrect());
        row.put(SUBTOPIC, question.subtopic());
        row.put(CORRECT_ANSWER, question.correctAnswer());
        row.put(TOLERANCE, question.type() == QuestionType.NUMERICAL ? formatNumber(question.tolerance()) : null);
        return row;
    }

    private String formatNumber(double value) {
        return Double.isFinite(value) ? NumberText.plain(value) : String.valueOf(value);
    }
}
