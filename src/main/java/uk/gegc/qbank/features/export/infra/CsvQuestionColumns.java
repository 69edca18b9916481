package uk.gegc.qbank.features.export.infra;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Column layout of the CSV package: fixed leading columns, one column per choice slot,
 * feedback columns, then the trailing answer-key columns.
 */
public final class CsvQuestionColumns {

    public static final String ID = "id";
    public static final String TYPE = "type";
    public static final String TEXT = "text";
    public static final String POINTS = "points";
    public static final String TOPIC = "topic";
    public static final String DIFFICULTY = "difficulty";
    public static final String CHOICE_PREFIX = "choice_";
    public static final String FEEDBACK_CORRECT = "feedback_correct";
    public static final String FEEDBACK_INCORRECT = "feedback_incorrect";
    public static final String SUBTOPIC = "subtopic";
    public static final String CORRECT_ANSWER = "correct_answer";
    public static final String TOLERANCE = "tolerance";

    private CsvQuestionColumns() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String choiceColumn(int index) {
        return CHOICE_PREFIX + (index + 1);
    }

    public static List<String> header(int choiceSlots) {
        List<String> columns = new ArrayList<>(List.of(ID, TYPE, TEXT, POINTS, TOPIC, DIFFICULTY));
        for (int i = 0; i < choiceSlots; i++) {
            columns.add(choiceColumn(i));
        }
        columns.addAll(List.of(FEEDBACK_CORRECT, FEEDBACK_INCORRECT, SUBTOPIC, CORRECT_ANSWER, TOLERANCE));
        return columns;
    }

    public static CsvSchema schema(int choiceSlots) {
        CsvSchema.Builder builder = CsvSchema.builder();
        header(choiceSlots).forEach(builder::addColumn);
        return builder.build();
    }
}
