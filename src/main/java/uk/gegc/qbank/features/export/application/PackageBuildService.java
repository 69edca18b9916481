package uk.gegc.qbank.features.export.application;

import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

public interface PackageBuildService {

    /**
     * Converts math notation, renders the package and runs the integrity check on the result.
     *
     * @throws uk.gegc.qbank.shared.exception.PackagingException      if a question cannot be rendered as QTI
     * @throws uk.gegc.qbank.shared.exception.ExportIntegrityException if the built package has a fatal issue
     */
    PackageResult build(QuestionCollection collection, ExportFormat format, PackageOptions options);
}
