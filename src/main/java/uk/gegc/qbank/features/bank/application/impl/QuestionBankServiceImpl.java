package uk.gegc.qbank.features.bank.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qbank.features.bank.application.QuestionBankService;
import uk.gegc.qbank.features.bank.application.io.QuestionBankReader;
import uk.gegc.qbank.features.export.application.PackageBuildService;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.merge.application.QuestionBankMergeService;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.shared.exception.StructuralException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionBankServiceImpl implements QuestionBankService {

    private final QuestionBankReader reader;
    private final QuestionBankMergeService mergeService;
    private final PackageBuildService packageBuildService;

    @Override
    public List<QuestionCollection> read(List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("At least one question bank file is required");
        }
        List<QuestionCollection> sources = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename() != null ? file.getOriginalFilename() : file.getName();
            if (file.isEmpty()) {
                throw new StructuralException("Uploaded file '" + name + "' is empty");
            }
            try (InputStream in = file.getInputStream()) {
                QuestionCollection collection = reader.read(in);
                log.debug("Read question bank: file={}, questions={}", name, collection.size());
                sources.add(collection);
            } catch (StructuralException e) {
                throw new StructuralException("Uploaded file '" + name + "': " + e.getMessage(), e);
            } catch (IOException e) {
                throw new StructuralException("Uploaded file '" + name + "' could not be read", e);
            }
        }
        return sources;
    }

    @Override
    public List<SourceViolation> validate(List<QuestionCollection> sources) {
        if (sources == null) {
            throw new IllegalArgumentException("Sources cannot be null");
        }
        List<SourceViolation> violations = mergeService.validate(sources);
        int questionCount = sources.stream().mapToInt(QuestionCollection::size).sum();
        log.info("Question bank validation completed: sources={}, questions={}, violations={}",
                sources.size(), questionCount, violations.size());
        return violations;
    }

    @Override
    public MergeResult merge(List<QuestionCollection> sources) {
        return mergeService.merge(sources);
    }

    @Override
    public PackageResult export(List<QuestionCollection> sources, ExportFormat format, PackageOptions options) {
        if (format == null) {
            throw new IllegalArgumentException("Export format is required");
        }
        MergeResult merged = mergeService.merge(sources);
        return packageBuildService.build(merged.collection(), format,
                options != null ? options : PackageOptions.defaults());
    }
}
