package uk.gegc.qbank.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;

import java.util.List;
import java.util.Set;

@Component
public class TrueFalseRules extends QuestionTypeRules {

    public static final String TRUE = "True";
    public static final String FALSE = "False";

    @Override
    public Set<QuestionType> supportedTypes() {
        return Set.of(QuestionType.TRUE_FALSE);
    }

    @Override
    public void check(Question question, List<QuestionViolation> violations) {
        String answer = question.correctAnswer();
        // exact match only, "true" and " True" are rejected
        if (!TRUE.equals(answer) && !FALSE.equals(answer)) {
            violations.add(new QuestionViolation(ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer",
                    "true_false correct_answer must be exactly 'True' or 'False', got '" + answer + "'"));
        }
    }
}
