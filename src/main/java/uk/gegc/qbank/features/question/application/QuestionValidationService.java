package uk.gegc.qbank.features.question.application;

import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;

import java.util.List;

public interface QuestionValidationService {

    /**
     * Checks structural completeness, type-specific answer rules, math delimiters and value ranges.
     *
     * @return every violation found, empty when the question is valid
     * @throws IllegalArgumentException if {@code question} is null
     */
    List<QuestionViolation> validate(Question question);
}
