package uk.gegc.qbank.shared.api.problem;

import java.net.URI;

/**
 * Centralised catalog of RFC 7807 Problem Detail type URIs.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://qbank.gegc.uk/docs/errors";

    // ==================== Input Errors ====================
    public static final URI MALFORMED_QUESTION_BANK = URI.create(BASE_URL + "/malformed-question-bank");
    public static final URI QUESTION_VALIDATION_FAILED = URI.create(BASE_URL + "/question-validation-failed");
    public static final URI INVALID_NOTATION = URI.create(BASE_URL + "/invalid-notation");
    public static final URI INVALID_ARGUMENT = URI.create(BASE_URL + "/invalid-argument");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI UNSUPPORTED_OPERATION = URI.create(BASE_URL + "/unsupported-operation");

    // ==================== Packaging Errors ====================
    public static final URI PACKAGING_FAILED = URI.create(BASE_URL + "/packaging-failed");
    public static final URI EXPORT_INTEGRITY_FAILED = URI.create(BASE_URL + "/export-integrity-failed");

    // ==================== Generic Errors ====================
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
