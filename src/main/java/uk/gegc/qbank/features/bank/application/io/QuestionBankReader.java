package uk.gegc.qbank.features.bank.application.io;

import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.io.InputStream;

/**
 * Reader for portable question bank files.
 */
public interface QuestionBankReader {

    /**
     * @throws uk.gegc.qbank.shared.exception.StructuralException if the input is not a question bank
     */
    QuestionCollection read(InputStream input);
}
