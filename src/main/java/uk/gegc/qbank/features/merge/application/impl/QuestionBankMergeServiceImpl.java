package uk.gegc.qbank.features.merge.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.qbank.features.merge.application.ConflictResolver;
import uk.gegc.qbank.features.merge.application.ContentDuplicateDetector;
import uk.gegc.qbank.features.merge.application.QuestionBankMergeService;
import uk.gegc.qbank.features.merge.domain.model.DuplicateCandidate;
import uk.gegc.qbank.features.merge.domain.model.MergeReport;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.ResolvedIdSpace;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.application.QuestionValidationService;
import uk.gegc.qbank.features.question.domain.model.CollectionMetadata;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.shared.config.QuestionBankProperties;
import uk.gegc.qbank.shared.exception.QuestionValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionBankMergeServiceImpl implements QuestionBankMergeService {

    static final String DEFAULT_FORMAT_VERSION = "1.0";
    private static final DateTimeFormatter CREATED_DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final QuestionValidationService validationService;
    private final ConflictResolver conflictResolver;
    private final ContentDuplicateDetector duplicateDetector;
    private final QuestionBankProperties properties;
    private final Clock clock;

    @Override
    public MergeResult merge(List<QuestionCollection> collections) {
        if (collections == null || collections.isEmpty()) {
            throw new IllegalArgumentException("At least one question bank is required");
        }
        if (collections.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Question banks must not contain null entries");
        }
        int maxSources = properties.getMerge().getMaxSources();
        if (collections.size() > maxSources) {
            throw new IllegalArgumentException("Cannot merge more than " + maxSources + " question banks");
        }

        Instant start = clock.instant();

        List<SourceViolation> violations = validate(collections);
        if (!violations.isEmpty()) {
            log.info("Merge rejected: sources={}, violations={}", collections.size(), violations.size());
            throw new QuestionValidationException(violations);
        }

        ResolvedIdSpace idSpace = conflictResolver.resolve(collections);

        List<Question> merged = new ArrayList<>();
        for (int source = 0; source < collections.size(); source++) {
            List<Question> questions = collections.get(source).questions();
            for (int position = 0; position < questions.size(); position++) {
                Question question = questions.get(position);
                String finalId = idSpace.finalId(source, position);
                merged.add(finalId.equals(question.id()) ? question : question.withId(finalId));
            }
        }

        List<DuplicateCandidate> duplicates = duplicateDetector.detect(
                collections, idSpace, properties.getMerge().getDuplicateSimilarityThreshold());

        int totalIn = collections.stream().mapToInt(QuestionCollection::size).sum();
        MergeReport report = new MergeReport(
                collections.size(),
                totalIn,
                merged.size(),
                idSpace.conflicts().size(),
                idSpace.conflicts(),
                duplicates
        );

        QuestionCollection result = new QuestionCollection(merged, mergeMetadata(collections));

        long durationMs = Duration.between(start, clock.instant()).toMillis();
        log.info("Question bank merge completed: sources={}, totalIn={}, totalOut={}, collisions={}, duplicateCandidates={}, durationMs={}",
                report.sourceCount(), report.totalIn(), report.totalOut(), report.collisionCount(),
                duplicates.size(), durationMs);

        return new MergeResult(result, report);
    }

    @Override
    public List<SourceViolation> validate(List<QuestionCollection> collections) {
        if (collections == null || collections.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Question banks must not be null");
        }
        List<SourceViolation> violations = new ArrayList<>();
        for (int source = 0; source < collections.size(); source++) {
            List<Question> questions = collections.get(source).questions();
            for (int position = 0; position < questions.size(); position++) {
                Question question = questions.get(position);
                for (QuestionViolation violation : validationService.validate(question)) {
                    violations.add(new SourceViolation(source, position, question.id(),
                            violation.kind(), violation.field(), violation.message()));
                }
            }
        }
        return violations;
    }

    private CollectionMetadata mergeMetadata(List<QuestionCollection> collections) {
        Set<String> subjects = new LinkedHashSet<>();
        for (QuestionCollection collection : collections) {
            String subject = collection.metadata().subject();
            if (subject != null && !subject.isBlank()) {
                subjects.add(subject.trim());
            }
        }

        String formatVersion = collections.get(0).metadata().formatVersion();
        if (formatVersion == null || formatVersion.isBlank()) {
            formatVersion = DEFAULT_FORMAT_VERSION;
        }

        return new CollectionMetadata(
                subjects.isEmpty() ? null : String.join(" + ", subjects),
                formatVersion,
                LocalDateTime.now(clock).format(CREATED_DATE_FORMAT)
        );
    }
}
