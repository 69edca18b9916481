package uk.gegc.qbank.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;

import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

@Component
public class NumericalRules extends QuestionTypeRules {

    @Override
    public Set<QuestionType> supportedTypes() {
        return Set.of(QuestionType.NUMERICAL);
    }

    @Override
    public void check(Question question, List<QuestionViolation> violations) {
        if (parseAnswer(question.correctAnswer()).isEmpty()) {
            violations.add(new QuestionViolation(ViolationKind.NON_NUMERIC_ANSWER, "correct_answer",
                    "numerical correct_answer must be a finite number, got '" + question.correctAnswer() + "'"));
        }
    }

    /**
     * Parses a numerical answer key; empty when the value is missing, not a number or not finite.
     */
    public static OptionalDouble parseAnswer(String raw) {
        if (isBlank(raw)) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(raw.trim());
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
