package uk.gegc.qbank.features.question.infra.rules;

import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;

import java.util.List;
import java.util.Set;

/**
 * Answer-key rules specific to one or more question types.
 */
public abstract class QuestionTypeRules {

    public abstract Set<QuestionType> supportedTypes();

    /**
     * Appends every rule failure for {@code question} to {@code violations}. Never throws for bad content.
     */
    public abstract void check(Question question, List<QuestionViolation> violations);

    protected static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
