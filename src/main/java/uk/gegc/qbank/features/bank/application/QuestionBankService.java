package uk.gegc.qbank.features.bank.application;

import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

/**
 * Entry point for uploaded question banks: reading, validation, merging and packaging.
 */
public interface QuestionBankService {

    /**
     * Reads every upload as a portable question bank, in upload order.
     *
     * @throws uk.gegc.qbank.shared.exception.StructuralException naming the first upload that is not a bank
     */
    List<QuestionCollection> read(List<MultipartFile> files);

    /**
     * Validates every question of every source without stopping at the first failure.
     */
    List<SourceViolation> validate(List<QuestionCollection> sources);

    MergeResult merge(List<QuestionCollection> sources);

    /**
     * Merges the sources and builds one package from the result.
     */
    PackageResult export(List<QuestionCollection> sources, ExportFormat format, PackageOptions options);
}
