package uk.gegc.qbank.features.question.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of question variants understood by the merge engine and the package builder.
 */
public enum QuestionType {
    MULTIPLE_CHOICE("multiple_choice", "multiple_choice_question"),
    TRUE_FALSE("true_false", "true_false_question"),
    NUMERICAL("numerical", "numerical_question"),
    FILL_IN_BLANK("fill_in_blank", "short_answer_question"),
    SHORT_ANSWER("short_answer", "short_answer_question"),
    ESSAY("essay", "essay_question");

    // Legacy spellings seen in hand-authored banks
    private static final Map<String, QuestionType> ALIASES = Map.ofEntries(
            Map.entry("mc", MULTIPLE_CHOICE),
            Map.entry("multiple choice", MULTIPLE_CHOICE),
            Map.entry("multiplechoice", MULTIPLE_CHOICE),
            Map.entry("tf", TRUE_FALSE),
            Map.entry("true/false", TRUE_FALSE),
            Map.entry("truefalse", TRUE_FALSE),
            Map.entry("num", NUMERICAL),
            Map.entry("numeric", NUMERICAL),
            Map.entry("fib", FILL_IN_BLANK),
            Map.entry("fill_in_the_blank", FILL_IN_BLANK)
    );

    private final String value;
    private final String lmsItemType;

    QuestionType(String value, String lmsItemType) {
        this.value = value;
        this.lmsItemType = lmsItemType;
    }

    /**
     * Wire name used in the portable JSON format and the CSV export.
     */
    public String value() {
        return value;
    }

    /**
     * Item type label written into QTI item metadata.
     */
    public String lmsItemType() {
        return lmsItemType;
    }

    public boolean isChoiceBased() {
        return this == MULTIPLE_CHOICE || this == TRUE_FALSE;
    }

    public static Optional<QuestionType> fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        Optional<QuestionType> direct = Arrays.stream(values())
                .filter(type -> type.value.equals(normalized))
                .findFirst();
        if (direct.isPresent()) {
            return direct;
        }
        return Optional.ofNullable(ALIASES.get(normalized));
    }
}
