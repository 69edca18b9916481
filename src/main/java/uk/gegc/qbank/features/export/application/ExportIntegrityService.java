package uk.gegc.qbank.features.export.application;

import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

public interface ExportIntegrityService {

    /**
     * Re-reads built package bytes and compares them with the source collection.
     *
     * @return every issue found, empty when the package is sound; fatal issues are included, never thrown
     */
    List<ExportIssue> check(byte[] content, ExportFormat format, QuestionCollection source);
}
