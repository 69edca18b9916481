package uk.gegc.qbank.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;

import java.util.List;
import java.util.Set;

@Component
public class TextAnswerRules extends QuestionTypeRules {

    @Override
    public Set<QuestionType> supportedTypes() {
        return Set.of(QuestionType.FILL_IN_BLANK, QuestionType.SHORT_ANSWER);
    }

    @Override
    public void check(Question question, List<QuestionViolation> violations) {
        if (isBlank(question.correctAnswer())) {
            violations.add(new QuestionViolation(ViolationKind.MISSING_CORRECT_ANSWER, "correct_answer",
                    question.type().value() + " requires a non-blank correct_answer"));
        }
    }
}
