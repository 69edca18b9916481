package uk.gegc.qbank.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;

import java.util.List;
import java.util.Set;

@Component
public class MultipleChoiceRules extends QuestionTypeRules {

    @Override
    public Set<QuestionType> supportedTypes() {
        return Set.of(QuestionType.MULTIPLE_CHOICE);
    }

    @Override
    public void check(Question question, List<QuestionViolation> violations) {
        List<String> choices = question.choices();
        if (choices.isEmpty()) {
            violations.add(new QuestionViolation(ViolationKind.MISSING_CHOICES, "choices",
                    "multiple_choice must have at least one choice"));
            return;
        }

        for (int i = 0; i < choices.size(); i++) {
            if (isBlank(choices.get(i))) {
                violations.add(new QuestionViolation(ViolationKind.BLANK_CHOICE, "choices[" + i + "]",
                        "Choice " + (i + 1) + " is blank"));
            }
        }

        if (!choices.contains(question.correctAnswer())) {
            violations.add(new QuestionViolation(ViolationKind.CORRECT_ANSWER_NOT_IN_CHOICES, "correct_answer",
                    "correct_answer '" + question.correctAnswer() + "' does not match any choice"));
        }
    }
}
