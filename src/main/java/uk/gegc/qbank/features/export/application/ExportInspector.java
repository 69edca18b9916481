package uk.gegc.qbank.features.export.application;

import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

/**
 * SPI for re-reading a built package and checking it against its source collection.
 */
public interface ExportInspector {
    boolean supports(ExportFormat format);

    List<ExportIssue> inspect(byte[] content, QuestionCollection source);
}
