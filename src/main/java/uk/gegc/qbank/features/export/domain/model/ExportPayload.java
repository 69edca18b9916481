package uk.gegc.qbank.features.export.domain.model;

import uk.gegc.qbank.features.notation.domain.model.TargetDialect;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.time.LocalDateTime;

/**
 * Input handed to an {@code ExportRenderer}.
 *
 * @param collection   questions to package, in display order
 * @param title        assessment title shown by the LMS
 * @param filenameBase sanitized file name without extension
 * @param dialect      math delimiter dialect of the target renderer
 * @param generatedAt  timestamp written into package metadata
 */
public record ExportPayload(
        QuestionCollection collection,
        String title,
        String filenameBase,
        TargetDialect dialect,
        LocalDateTime generatedAt
) {
    public ExportPayload {
        if (collection == null) {
            throw new IllegalArgumentException("Collection cannot be null");
        }
        if (generatedAt == null) {
            throw new IllegalArgumentException("Generation timestamp cannot be null");
        }
        if (title == null || title.isBlank()) {
            title = "Question Bank";
        }
        if (filenameBase == null || filenameBase.isBlank()) {
            filenameBase = "question_package";
        }
        if (dialect == null) {
            dialect = TargetDialect.CANVAS;
        }
    }
}
