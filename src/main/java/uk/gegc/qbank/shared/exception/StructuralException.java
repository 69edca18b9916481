package uk.gegc.qbank.shared.exception;

/**
 * Raised when an input bank cannot be read as a collection at all: malformed JSON,
 * a missing {@code questions} array or a question entry that is not an object.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
