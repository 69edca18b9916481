package uk.gegc.qbank.features.merge.application;

import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

public interface QuestionBankMergeService {

    /**
     * Runs the question validator over every source and locates each violation by source and position.
     * This is the same check {@link #merge(List)} applies before merging.
     */
    List<SourceViolation> validate(List<QuestionCollection> collections);

    /**
     * Validates every source, resolves id collisions and concatenates the sources in order.
     *
     * @throws uk.gegc.qbank.shared.exception.QuestionValidationException if any question of any source is invalid;
     *                                                                    nothing is merged in that case
     */
    MergeResult merge(List<QuestionCollection> collections);
}
