package uk.gegc.qbank.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.qbank.features.export.application.ExportIntegrityService;
import uk.gegc.qbank.features.export.application.ExportRenderer;
import uk.gegc.qbank.features.export.application.PackageBuildService;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.export.domain.model.ExportPayload;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.export.domain.model.RenderedPackage;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.shared.config.QuestionBankProperties;
import uk.gegc.qbank.shared.exception.ExportIntegrityException;
import uk.gegc.qbank.shared.util.FilenameSanitizer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PackageBuildServiceImpl implements PackageBuildService {

    private static final DateTimeFormatter DEFAULT_NAME_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final List<ExportRenderer> renderers;
    private final ExportIntegrityService integrityService;
    private final QuestionBankProperties properties;
    private final Clock clock;

    @Override
    public PackageResult build(QuestionCollection collection, ExportFormat format, PackageOptions options) {
        if (collection == null) {
            throw new IllegalArgumentException("Collection must not be null");
        }
        if (format == null) {
            throw new IllegalArgumentException("Export format must not be null");
        }
        PackageOptions effective = options != null ? options : PackageOptions.defaults();

        Instant startTime = clock.instant();
        LocalDateTime generatedAt = LocalDateTime.now(clock);

        String title = effective.title() != null && !effective.title().isBlank()
                ? effective.title().strip()
                : properties.getExport().getDefaultTitle();
        TargetDialect dialect = effective.dialect() != null
                ? effective.dialect()
                : properties.getExport().getDefaultDialect();
        String filenameBase = resolveFilenameBase(effective.filename(), effective.title(), generatedAt);

        ExportPayload payload = new ExportPayload(collection, title, filenameBase, dialect, generatedAt);
        RenderedPackage rendered = resolveRenderer(format).render(payload);

        byte[] content = rendered.file().readAllBytes();
        List<ExportIssue> issues = integrityService.check(content, format, collection);
        if (issues.stream().anyMatch(ExportIssue::isFatal)) {
            log.error("Built package failed integrity check: format={}, filename={}, issues={}",
                    format, rendered.file().filename(), issues);
            throw new ExportIntegrityException(issues);
        }
        issues.forEach(issue -> log.warn("Export issue: code={}, questionId={}, message={}",
                issue.code(), issue.questionId(), issue.message()));

        long durationMs = Duration.between(startTime, clock.instant()).toMillis();
        log.info("Package build completed: format={}, dialect={}, filename={}, questions={}, skipped={}, issues={}, bytes={}, durationMs={}",
                format, dialect, rendered.file().filename(), collection.size(), rendered.failures().size(),
                issues.size(), content.length, durationMs);

        return new PackageResult(rendered.file(), rendered.failures(), issues);
    }

    /**
     * Prefers the requested filename, then the requested title, then {@code Question_Package_<timestamp>}.
     */
    private String resolveFilenameBase(String requested, String title, LocalDateTime generatedAt) {
        int maxLength = properties.getExport().getMaxFilenameLength();
        String base = FilenameSanitizer.sanitize(FilenameSanitizer.stripExtension(requested, "zip", "csv", "xml"), maxLength);
        if (base.isEmpty()) {
            base = FilenameSanitizer.sanitize(title, maxLength);
        }
        if (base.isEmpty()) {
            base = "Question_Package_" + generatedAt.format(DEFAULT_NAME_TIMESTAMP);
        }
        return base;
    }

    private ExportRenderer resolveRenderer(ExportFormat format) {
        return renderers.stream()
                .filter(renderer -> renderer.supports(format))
                .findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("No renderer for format " + format));
    }
}
