package uk.gegc.qbank.features.export.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.notation.application.NotationTransformer;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Produces a render-ready copy of a question with every math-bearing field in the target dialect.
 * Id, type and metadata are never touched. A multiple-choice answer is transformed along with the
 * choices so it still matches its choice verbatim.
 */
@Component
@RequiredArgsConstructor
public class QuestionNotationPreparer {

    private final NotationTransformer transformer;

    /**
     * @throws uk.gegc.qbank.shared.exception.NotationException if any field holds invalid portable math
     */
    public Question prepare(Question question, TargetDialect dialect) {
        List<String> choices = new ArrayList<>(question.choices().size());
        for (String choice : question.choices()) {
            choices.add(transformer.transform(choice, dialect));
        }
        String correctAnswer = question.type() == QuestionType.MULTIPLE_CHOICE
                ? transformer.transform(question.correctAnswer(), dialect)
                : question.correctAnswer();
        return question.toBuilder()
                .text(transformer.transform(question.text(), dialect))
                .choices(choices)
                .correctAnswer(correctAnswer)
                .feedbackCorrect(transformer.transform(question.feedbackCorrect(), dialect))
                .feedbackIncorrect(transformer.transform(question.feedbackIncorrect(), dialect))
                .build();
    }
}
