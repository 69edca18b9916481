package uk.gegc.qbank.features.merge.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import uk.gegc.qbank.BaseUnitTest;
import uk.gegc.qbank.features.merge.application.ConflictResolver;
import uk.gegc.qbank.features.merge.application.ContentDuplicateDetector;
import uk.gegc.qbank.features.merge.domain.model.ConflictAssessment;
import uk.gegc.qbank.features.merge.domain.model.ConflictRecord;
import uk.gegc.qbank.features.merge.domain.model.MergeReport;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.application.QuestionValidationService;
import uk.gegc.qbank.features.question.domain.model.CollectionMetadata;
import uk.gegc.qbank.features.question.domain.model.Question;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.QuestionViolation;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;
import uk.gegc.qbank.shared.config.QuestionBankProperties;
import uk.gegc.qbank.shared.exception.QuestionValidationException;
import uk.gegc.qbank.testsupport.QuestionFixtures;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@DisplayName("QuestionBankMergeServiceImpl Tests")
class QuestionBankMergeServiceImplTest extends BaseUnitTest {

    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    @Mock
    private QuestionValidationService validationService;

    private QuestionBankProperties properties;
    private QuestionBankMergeServiceImpl mergeService;

    @BeforeEach
    void setUp() {
        properties = new QuestionBankProperties();
        mergeService = new QuestionBankMergeServiceImpl(
                validationService,
                new ConflictResolver(),
                new ContentDuplicateDetector(),
                properties,
                FIXED_CLOCK
        );
        lenient().when(validationService.validate(any())).thenReturn(List.of());
    }

    @Test
    @DisplayName("merge: colliding id is renamed and recorded")
    void merge_collision_renamesAndReports() {
        // Given
        QuestionCollection a = QuestionFixtures.collection(QuestionFixtures.multipleChoice("Q1"));
        QuestionCollection b = QuestionFixtures.collection(QuestionFixtures.trueFalse("Q1"), QuestionFixtures.numerical("Q2"));

        // When
        MergeResult result = mergeService.merge(List.of(a, b));

        // Then
        assertThat(result.collection().questions()).extracting(Question::id).containsExactly("Q1", "Q1_1", "Q2");
        MergeReport report = result.report();
        assertThat(report.sourceCount()).isEqualTo(2);
        assertThat(report.totalIn()).isEqualTo(3);
        assertThat(report.totalOut()).isEqualTo(3);
        assertThat(report.collisionCount()).isEqualTo(1);
        assertThat(report.conflicts()).containsExactly(
                new ConflictRecord(1, 0, "Q1", "Q1_1", 0.0, ConflictAssessment.DIFFERENT));
    }

    @Test
    @DisplayName("merge: output equals inputs modulo id, in order")
    void merge_isLosslessModuloId() {
        // Given
        QuestionCollection a = QuestionFixtures.allTypes();
        QuestionCollection b = QuestionFixtures.allTypes();

        // When
        MergeResult result = mergeService.merge(List.of(a, b));

        // Then
        List<Question> expected = new ArrayList<>(a.questions());
        expected.addAll(b.questions());
        List<Question> merged = result.collection().questions();
        assertThat(merged).hasSize(expected.size());
        for (int i = 0; i < merged.size(); i++) {
            assertThat(merged.get(i).withId(null)).isEqualTo(expected.get(i).withId(null));
        }
        assertThat(merged).extracting(Question::id).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("merge: without collisions the result is a plain concatenation")
    void merge_noCollisions_concatenates() {
        // Given
        QuestionCollection a = QuestionFixtures.collection(QuestionFixtures.multipleChoice("A1"), QuestionFixtures.essay("A2"));
        QuestionCollection b = QuestionFixtures.collection(QuestionFixtures.shortAnswer("B1"));

        // When
        MergeResult result = mergeService.merge(List.of(a, b));

        // Then
        List<Question> expected = new ArrayList<>(a.questions());
        expected.addAll(b.questions());
        assertThat(result.collection().questions()).isEqualTo(expected);
        assertThat(result.report().conflicts()).isEmpty();
    }

    @Test
    @DisplayName("merge: same-text questions across sources are flagged but kept")
    void merge_duplicateStems_reportedAsCandidates() {
        // Given
        QuestionCollection a = QuestionFixtures.collection(QuestionFixtures.multipleChoice("Q1"));
        QuestionCollection b = QuestionFixtures.collection(QuestionFixtures.multipleChoice("Q9"));

        // When
        MergeResult result = mergeService.merge(List.of(a, b));

        // Then
        assertThat(result.collection().size()).isEqualTo(2);
        assertThat(result.report().duplicateCandidates()).hasSize(1);
        assertThat(result.report().duplicateCandidates().get(0).secondId()).isEqualTo("Q9");
    }

    @Test
    @DisplayName("merge: metadata joins subjects and stamps the clock time")
    void merge_metadata_combinesSources() {
        // Given
        QuestionCollection a = new QuestionCollection(
                List.of(QuestionFixtures.essay("E1")), new CollectionMetadata("Physics", "2.0", "2025-01-01"));
        QuestionCollection b = new QuestionCollection(
                List.of(QuestionFixtures.essay("E2")), new CollectionMetadata("Chemistry", "1.0", null));

        // When
        CollectionMetadata metadata = mergeService.merge(List.of(a, b)).collection().metadata();

        // Then
        assertThat(metadata.subject()).isEqualTo("Physics + Chemistry");
        assertThat(metadata.formatVersion()).isEqualTo("2.0");
        assertThat(metadata.createdDate()).isEqualTo("2026-03-01T10:15:30");
    }

    @Test
    @DisplayName("merge: missing subjects and version fall back to defaults")
    void merge_metadataMissing_usesDefaults() {
        CollectionMetadata metadata = mergeService.merge(List.of(QuestionFixtures.collection(QuestionFixtures.essay("E1"))))
                .collection().metadata();

        assertThat(metadata.subject()).isNull();
        assertThat(metadata.formatVersion()).isEqualTo(QuestionBankMergeServiceImpl.DEFAULT_FORMAT_VERSION);
    }

    @Test
    @DisplayName("merge: any invalid question aborts with every violation located")
    void merge_invalidQuestion_throwsWithAllViolations() {
        // Given
        Question broken = QuestionFixtures.trueFalse("Q7");
        when(validationService.validate(argThat(q -> q != null && "Q7".equals(q.id()))))
                .thenReturn(List.of(new QuestionViolation(ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad")));
        QuestionCollection a = QuestionFixtures.collection(QuestionFixtures.multipleChoice("Q1"));
        QuestionCollection b = QuestionFixtures.collection(QuestionFixtures.essay("Q2"), broken);

        // When / Then
        assertThatThrownBy(() -> mergeService.merge(List.of(a, b)))
                .isInstanceOf(QuestionValidationException.class)
                .satisfies(ex -> assertThat(((QuestionValidationException) ex).getViolations())
                        .containsExactly(new SourceViolation(1, 1, "Q7", ViolationKind.INVALID_BOOLEAN_ANSWER,
                                "correct_answer", "bad")));
    }

    @Test
    @DisplayName("validate: reports violations of every source without merging")
    void validate_locatesViolationsAcrossSources() {
        // Given
        when(validationService.validate(argThat(q -> q != null && "Q7".equals(q.id()))))
                .thenReturn(List.of(new QuestionViolation(ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad")));
        QuestionCollection a = QuestionFixtures.collection(QuestionFixtures.trueFalse("Q7"));
        QuestionCollection b = QuestionFixtures.collection(QuestionFixtures.essay("Q1"), QuestionFixtures.trueFalse("Q7"));

        // When
        List<SourceViolation> violations = mergeService.validate(List.of(a, b));

        // Then
        assertThat(violations).containsExactly(
                new SourceViolation(0, 0, "Q7", ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad"),
                new SourceViolation(1, 1, "Q7", ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad"));
    }

    @Test
    @DisplayName("validate: clean sources report nothing")
    void validate_validSources_empty() {
        assertThat(mergeService.validate(List.of(QuestionFixtures.allTypes(), QuestionFixtures.allTypes()))).isEmpty();
    }

    @Test
    @DisplayName("merge: empty or null input is rejected")
    void merge_emptyInput_throws() {
        assertThatThrownBy(() -> mergeService.merge(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mergeService.merge(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mergeService.merge(Arrays.asList(QuestionFixtures.allTypes(), null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("merge: more sources than configured are rejected")
    void merge_tooManySources_throws() {
        // Given
        properties.getMerge().setMaxSources(2);
        QuestionCollection source = QuestionFixtures.collection(QuestionFixtures.essay("E1"));

        // When / Then
        assertThatThrownBy(() -> mergeService.merge(List.of(source, source, source)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than 2");
    }
}
