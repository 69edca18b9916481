package uk.gegc.qbank.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.qbank.features.notation.application.MathSpanScanner;
import uk.gegc.qbank.features.notation.domain.model.NotationProblem;
import uk.gegc.qbank.features.question.application.QuestionValidationService;
import uk.gegc.qbank.features.question.domain.model.Difficulty;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;
import uk.gegc.qbank.features.question.infra.rules.QuestionTypeRulesFactory;
import uk.gegc.qbank.shared.config.QuestionBankProperties;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionValidationServiceImpl implements QuestionValidationService {

    private final MathSpanScanner scanner;
    private final QuestionTypeRulesFactory rulesFactory;
    private final QuestionBankProperties properties;

    @Override
    public List<QuestionViolation> validate(Question question) {
        if (question == null) {
            throw new IllegalArgumentException("Question must not be null");
        }

        List<QuestionViolation> violations = new ArrayList<>();
        checkRequiredFields(question, violations);
        if (question.type() != null) {
            rulesFactory.getRules(question.type()).check(question, violations);
        }
        checkNotation(question, violations);
        checkRanges(question, violations);

        if (!violations.isEmpty()) {
            log.debug("Question {} has {} violation(s): {}", question.id(), violations.size(),
                    violations.stream().map(QuestionViolation::kind).toList());
        }
        return violations;
    }

    private void checkRequiredFields(Question question, List<QuestionViolation> violations) {
        if (isBlank(question.id())) {
            violations.add(new QuestionViolation(ViolationKind.MISSING_ID, "id", "Question id is required"));
        }
        if (isBlank(question.text())) {
            violations.add(new QuestionViolation(ViolationKind.MISSING_TEXT, "text", "Question text is required"));
        } else if (question.text().length() > properties.getValidation().getMaxTextLength()) {
            violations.add(new QuestionViolation(ViolationKind.TEXT_TOO_LONG, "text",
                    "Question text exceeds " + properties.getValidation().getMaxTextLength() + " characters"));
        }
        if (question.type() == null) {
            violations.add(new QuestionViolation(ViolationKind.UNRECOGNIZED_TYPE, "type",
                    "Question type is missing or not recognized"));
        }
    }

    private void checkNotation(Question question, List<QuestionViolation> violations) {
        scanField("text", question.text(), violations);
        List<String> choices = question.choices();
        for (int i = 0; i < choices.size(); i++) {
            scanField("choices[" + i + "]", choices.get(i), violations);
        }
        scanField("feedback_correct", question.feedbackCorrect(), violations);
        scanField("feedback_incorrect", question.feedbackIncorrect(), violations);
    }

    private void scanField(String field, String value, List<QuestionViolation> violations) {
        for (NotationProblem problem : scanner.scan(value).problems()) {
            ViolationKind kind = switch (problem.kind()) {
                case DELIMITER_IMBALANCE -> ViolationKind.DELIMITER_IMBALANCE;
                case NESTED_DELIMITER -> ViolationKind.NESTED_DELIMITER;
                case EMPTY_MATH_SPAN -> ViolationKind.EMPTY_MATH_SPAN;
                case TARGET_DIALECT_PRESENT -> ViolationKind.TARGET_DIALECT_PRESENT;
            };
            violations.add(new QuestionViolation(kind, field, problem.describe()));
        }
    }

    private void checkRanges(Question question, List<QuestionViolation> violations) {
        double points = question.points();
        if (Double.isNaN(points) || points <= 0) {
            violations.add(new QuestionViolation(ViolationKind.NON_POSITIVE_POINTS, "points",
                    "points must be greater than 0, got " + points));
        }
        double tolerance = question.tolerance();
        if (Double.isNaN(tolerance) || tolerance < 0) {
            violations.add(new QuestionViolation(ViolationKind.NEGATIVE_TOLERANCE, "tolerance",
                    "tolerance must not be negative, got " + tolerance));
        }
        String difficulty = question.difficulty();
        if (difficulty != null && Difficulty.fromLabel(difficulty).isEmpty()) {
            violations.add(new QuestionViolation(ViolationKind.INVALID_DIFFICULTY, "metadata.difficulty",
                    "difficulty must be one of Easy, Medium, Hard, got '" + difficulty + "'"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
