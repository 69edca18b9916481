package uk.gegc.qbank.features.question.infra.rules;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;

import java.util.List;
import java.util.Set;

/**
 * Essays are graded manually and carry no answer key.
 */
@Component
public class EssayRules extends QuestionTypeRules {

    @Override
    public Set<QuestionType> supportedTypes() {
        return Set.of(QuestionType.ESSAY);
    }

    @Override
    public void check(Question question, List<QuestionViolation> violations) {
        // nothing to check
    }
}
