package uk.gegc.qbank.shared.exception;

import uk.gegc.qbank.features.merge.domain.model.SourceViolation;

import java.util.List;

/**
 * Carries every violation found across all merge sources. Thrown before anything is merged.
 */
public class QuestionValidationException extends RuntimeException {

    private final List<SourceViolation> violations;

    public QuestionValidationException(List<SourceViolation> violations) {
        super(violations.size() + " question violation(s) found; nothing was merged");
        this.violations = List.copyOf(violations);
    }

    public List<SourceViolation> getViolations() {
        return violations;
    }
}
