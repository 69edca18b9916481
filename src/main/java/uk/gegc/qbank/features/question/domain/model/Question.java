package uk.gegc.qbank.features.question.domain.model;

import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable question record as it flows through the merge and packaging pipeline.
 * Stages never modify a question in place; they derive copies through {@link #toBuilder()}.
 *
 * @param id                unique within one collection; rewritten by the merge engine on collision
 * @param type              question variant, {@code null} when the source named an unknown type
 * @param text              stem in the portable math dialect
 * @param choices           ordered answer options, empty for non-choice types
 * @param correctAnswer     choice text, numeric string or "True"/"False" depending on {@code type}
 * @param tolerance         accepted deviation for numerical answers, defaults to 0
 * @param points            score weight, defaults to 1
 * @param feedbackCorrect   optional feedback shown on a correct response
 * @param feedbackIncorrect optional feedback shown on an incorrect response
 * @param metadata          open key/value map; {@code topic}, {@code subtopic}, {@code difficulty} are recognized
 */
@Builder(toBuilder = true)
public record Question(
        String id,
        QuestionType type,
        String text,
        List<String> choices,
        String correctAnswer,
        Double tolerance,
        Double points,
        String feedbackCorrect,
        String feedbackIncorrect,
        Map<String, Object> metadata
) {
    public static final String TOPIC = "topic";
    public static final String SUBTOPIC = "subtopic";
    public static final String DIFFICULTY = "difficulty";

    public Question {
        // choices may legitimately hold nulls from sloppy input; the validator reports them
        choices = choices == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(choices));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (tolerance == null) {
            tolerance = 0.0;
        }
        if (points == null) {
            points = 1.0;
        }
    }

    public Question withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public String topic() {
        return metadataString(TOPIC);
    }

    public String subtopic() {
        return metadataString(SUBTOPIC);
    }

    public String difficulty() {
        return metadataString(DIFFICULTY);
    }

    private String metadataString(String key) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }
}
