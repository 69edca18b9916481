package uk.gegc.qbank.features.bank.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qbank.BaseUnitTest;
import uk.gegc.qbank.features.bank.application.io.QuestionBankReader;
import uk.gegc.qbank.features.export.application.PackageBuildService;
import uk.gegc.qbank.features.export.domain.model.ExportFile;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.merge.application.QuestionBankMergeService;
import uk.gegc.qbank.features.merge.domain.model.MergeReport;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;
import uk.gegc.qbank.shared.exception.StructuralException;
import uk.gegc.qbank.testsupport.QuestionFixtures;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("QuestionBankServiceImpl Tests")
class QuestionBankServiceImplTest extends BaseUnitTest {

    @Mock
    private QuestionBankReader reader;
    @Mock
    private QuestionBankMergeService mergeService;
    @Mock
    private PackageBuildService packageBuildService;

    @InjectMocks
    private QuestionBankServiceImpl questionBankService;

    private static MockMultipartFile upload(String name, String content) {
        return new MockMultipartFile("files", name, "application/json", content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("read: every upload is read in order")
    void read_uploads_readInOrder() {
        // Given
        QuestionCollection first = QuestionFixtures.collection(QuestionFixtures.essay("A"));
        QuestionCollection second = QuestionFixtures.collection(QuestionFixtures.essay("B"));
        when(reader.read(any())).thenReturn(first, second);

        // When
        List<QuestionCollection> sources = questionBankService.read(List.of(upload("a.json", "{}"), upload("b.json", "{}")));

        // Then
        assertThat(sources).containsExactly(first, second);
    }

    @Test
    @DisplayName("read: structural error names the offending upload")
    void read_structuralError_namesFile() {
        // Given
        when(reader.read(any())).thenThrow(new StructuralException("Malformed JSON question bank"));

        // When / Then
        assertThatThrownBy(() -> questionBankService.read(List.of(upload("broken.json", "{"))))
                .isInstanceOf(StructuralException.class)
                .hasMessage("Uploaded file 'broken.json': Malformed JSON question bank");
    }

    @Test
    @DisplayName("read: empty upload is a structural error")
    void read_emptyFile_throwsStructural() {
        assertThatThrownBy(() -> questionBankService.read(List.of(upload("empty.json", ""))))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("empty.json");
        verifyNoInteractions(reader);
    }

    @Test
    @DisplayName("read: no uploads is rejected")
    void read_noFiles_throws() {
        List<MultipartFile> none = List.of();
        assertThatThrownBy(() -> questionBankService.read(none))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("validate: uses the same located check the merge applies")
    void validate_delegatesToMergeValidation() {
        // Given
        List<QuestionCollection> sources = List.of(
                QuestionFixtures.collection(QuestionFixtures.essay("E1")),
                QuestionFixtures.collection(QuestionFixtures.essay("E2"), QuestionFixtures.trueFalse("T1")));
        List<SourceViolation> located = List.of(
                new SourceViolation(1, 1, "T1", ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad"));
        when(mergeService.validate(sources)).thenReturn(located);

        // When
        List<SourceViolation> violations = questionBankService.validate(sources);

        // Then
        assertThat(violations).isEqualTo(located);
        verify(mergeService).validate(sources);
        verifyNoInteractions(reader, packageBuildService);
    }

    @Test
    @DisplayName("validate: null sources are rejected")
    void validate_nullSources_throws() {
        assertThatThrownBy(() -> questionBankService.validate(null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mergeService);
    }

    @Test
    @DisplayName("export: merges first and packages the merged collection")
    void export_mergesThenBuilds() {
        // Given
        List<QuestionCollection> sources = List.of(QuestionFixtures.allTypes());
        QuestionCollection merged = QuestionFixtures.allTypes();
        when(mergeService.merge(sources)).thenReturn(new MergeResult(merged, new MergeReport(1, 6, 6, 0, List.of(), List.of())));
        PackageResult built = new PackageResult(
                ExportFile.ofBytes("bank.csv", "text/csv", new byte[]{1}), List.of(), List.of());
        PackageOptions options = PackageOptions.builder().title("Bank").build();
        when(packageBuildService.build(merged, ExportFormat.CSV, options)).thenReturn(built);

        // When
        PackageResult result = questionBankService.export(sources, ExportFormat.CSV, options);

        // Then
        assertThat(result).isSameAs(built);
        verify(packageBuildService).build(eq(merged), eq(ExportFormat.CSV), eq(options));
    }

    @Test
    @DisplayName("export: missing format is rejected before merging")
    void export_nullFormat_throws() {
        assertThatThrownBy(() -> questionBankService.export(List.of(QuestionFixtures.allTypes()), null, null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(mergeService);
    }
}
