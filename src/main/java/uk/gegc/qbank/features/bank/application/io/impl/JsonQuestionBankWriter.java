package uk.gegc.qbank.features.bank.application.io.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.bank.application.io.QuestionBankWriter;
import uk.gegc.qbank.features.question.domain.model.CollectionMetadata;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.QuestionType;

/**
 * Writes collections in the same layout {@link JsonQuestionBankReader} accepts, so a merged bank can be merged again.
 */
@Component
@RequiredArgsConstructor
public class JsonQuestionBankWriter implements QuestionBankWriter {

    private final ObjectMapper objectMapper;

    @Override
    public ObjectNode toJson(QuestionCollection collection) {
        if (collection == null) {
            throw new IllegalArgumentException("Collection must not be null");
        }

        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode questions = root.putArray("questions");
        for (Question question : collection.questions()) {
            questions.add(toJson(question));
        }
        root.set("metadata", toJson(collection.metadata()));
        return root;
    }

    @Override
    public byte[] write(QuestionCollection collection) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toJson(collection));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize question bank", e);
        }
    }

    private ObjectNode toJson(Question question) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("id", question.id());
        node.put("type", question.type() != null ? question.type().value() : null);
        node.put("text", question.text());
        ArrayNode choices = node.putArray("choices");
        question.choices().forEach(choices::add);
        node.put("correct_answer", question.correctAnswer());
        if (question.type() == QuestionType.NUMERICAL || question.tolerance() != 0.0) {
            node.put("tolerance", question.tolerance());
        }
        node.put("points", question.points());
        if (question.feedbackCorrect() != null) {
            node.put("feedback_correct", question.feedbackCorrect());
        }
        if (question.feedbackIncorrect() != null) {
            node.put("feedback_incorrect", question.feedbackIncorrect());
        }
        node.set("metadata", objectMapper.valueToTree(question.metadata()));
        return node;
    }

    private ObjectNode toJson(CollectionMetadata metadata) {
        ObjectNode node = objectMapper.createObjectNode();
        if (metadata.subject() != null) {
            node.put("subject", metadata.subject());
        }
        if (metadata.formatVersion() != null) {
            node.put("format_version", metadata.formatVersion());
        }
        if (metadata.createdDate() != null) {
            node.put("created_date", metadata.createdDate());
        }
        return node;
    }
}
