package uk.gegc.qbank.features.bank.application.io;

import com.fasterxml.jackson.databind.node.ObjectNode;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

/**
 * Serializes a collection back to the portable bank format.
 */
public interface QuestionBankWriter {

    ObjectNode toJson(QuestionCollection collection);

    byte[] write(QuestionCollection collection);
}
