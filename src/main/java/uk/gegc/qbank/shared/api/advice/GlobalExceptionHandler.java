package uk.gegc.qbank.shared.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import uk.gegc.qbank.shared.api.problem.ErrorTypes;
import uk.gegc.qbank.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.qbank.shared.exception.ExportIntegrityException;
import uk.gegc.qbank.shared.exception.NotationException;
import uk.gegc.qbank.shared.exception.PackagingException;
import uk.gegc.qbank.shared.exception.QuestionValidationException;
import uk.gegc.qbank.shared.exception.StructuralException;

import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(StructuralException.class)
    public ResponseEntity<ProblemDetail> handleStructural(StructuralException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.MALFORMED_QUESTION_BANK,
                "Malformed Question Bank",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(QuestionValidationException.class)
    public ResponseEntity<ProblemDetail> handleQuestionValidation(QuestionValidationException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.QUESTION_VALIDATION_FAILED,
                "Question Validation Failed",
                ex.getMessage(),
                request,
                Map.of("violations", ex.getViolations())
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(NotationException.class)
    public ResponseEntity<ProblemDetail> handleNotation(NotationException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.INVALID_NOTATION,
                "Invalid Math Notation",
                ex.getMessage(),
                request,
                Map.of("problems", ex.getProblems())
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(PackagingException.class)
    public ResponseEntity<ProblemDetail> handlePackaging(PackagingException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.UNPROCESSABLE_ENTITY,
                ErrorTypes.PACKAGING_FAILED,
                "Packaging Failed",
                ex.getMessage(),
                request,
                Map.of("failedQuestionIds", ex.getFailedQuestionIds(), "failures", ex.getFailures())
        );
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(problem);
    }

    @ExceptionHandler(ExportIntegrityException.class)
    public ResponseEntity<ProblemDetail> handleExportIntegrity(ExportIntegrityException ex, HttpServletRequest request) {
        logger.error("Export integrity failure: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.createWithProperties(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.EXPORT_INTEGRITY_FAILED,
                "Export Integrity Check Failed",
                "The built package did not pass its integrity check",
                request,
                Map.of("issues", ex.getIssues())
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedOperation(UnsupportedOperationException ex, HttpServletRequest request) {
        String message = ex.getMessage() != null ? ex.getMessage() : "Operation not supported";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.UNSUPPORTED_OPERATION,
                "Unsupported Operation",
                message,
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException ex, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.INVALID_ARGUMENT,
                "Invalid Argument",
                ex.getMessage(),
                request
        );
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String param = ex.getName();
        Class<?> type = ex.getRequiredType();
        String requiredType = type != null ? type.getSimpleName() : "unknown";
        String msg = "Invalid value for parameter '" + param + "'. Expected type: " + requiredType + ".";
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.TYPE_MISMATCH,
                "Type Mismatch",
                msg,
                request
        );
        problem.setProperty("parameter", param);
        problem.setProperty("expectedType", requiredType);
        problem.setProperty("providedValue", ex.getValue());
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleAllOthers(Exception ex, HttpServletRequest request) {
        logger.error("Unhandled exception: {}", ex.getMessage(), ex);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.INTERNAL_SERVER_ERROR,
                ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred",
                request
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problem);
    }
}
