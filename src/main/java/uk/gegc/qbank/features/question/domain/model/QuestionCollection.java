package uk.gegc.qbank.features.question.domain.model;

import java.util.List;

/**
 * Ordered set of questions loaded from one source. Order is display-significant.
 */
public record QuestionCollection(
        List<Question> questions,
        CollectionMetadata metadata
) {
    public QuestionCollection {
        if (questions == null) {
            throw new IllegalArgumentException("Questions list cannot be null");
        }
        questions = List.copyOf(questions);
        if (metadata == null) {
            metadata = CollectionMetadata.empty();
        }
    }

    public static QuestionCollection of(List<Question> questions) {
        return new QuestionCollection(questions, CollectionMetadata.empty());
    }

    public int size() {
        return questions.size();
    }
}
