package uk.gegc.qbank.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.qbank.features.export.application.ExportInspector;
import uk.gegc.qbank.features.export.application.ExportIntegrityService;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ExportIntegrityServiceImpl implements ExportIntegrityService {

    private final List<ExportInspector> inspectors;

    @Override
    public List<ExportIssue> check(byte[] content, ExportFormat format, QuestionCollection source) {
        if (content == null || format == null || source == null) {
            throw new IllegalArgumentException("Content, format and source collection are required");
        }

        List<ExportIssue> issues = resolveInspector(format).inspect(content, source);
        long fatal = issues.stream().filter(ExportIssue::isFatal).count();
        log.info("Export integrity check completed: format={}, bytes={}, questions={}, issues={}, fatal={}",
                format, content.length, source.size(), issues.size(), fatal);
        return issues;
    }

    private ExportInspector resolveInspector(ExportFormat format) {
        return inspectors.stream()
                .filter(inspector -> inspector.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No inspector for format " + format));
    }
}
