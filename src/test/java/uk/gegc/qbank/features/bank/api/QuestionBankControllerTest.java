package uk.gegc.qbank.features.bank.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.qbank.features.bank.application.QuestionBankService;
import uk.gegc.qbank.features.bank.application.io.impl.JsonQuestionBankWriter;
import uk.gegc.qbank.features.bank.infra.mapping.BankReportMapperImpl;
import uk.gegc.qbank.features.export.domain.model.ExportFile;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.export.domain.model.ExportIssueCode;
import uk.gegc.qbank.features.export.domain.model.PackageOptions;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.export.domain.model.PackagingFailure;
import uk.gegc.qbank.features.merge.domain.model.ConflictAssessment;
import uk.gegc.qbank.features.merge.domain.model.ConflictRecord;
import uk.gegc.qbank.features.merge.domain.model.MergeReport;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.notation.domain.model.TargetDialect;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;
import uk.gegc.qbank.features.question.domain.model.ViolationKind;
import uk.gegc.qbank.shared.exception.ExportIntegrityException;
import uk.gegc.qbank.shared.exception.PackagingException;
import uk.gegc.qbank.shared.exception.QuestionValidationException;
import uk.gegc.qbank.shared.exception.StructuralException;
import uk.gegc.qbank.testsupport.QuestionFixtures;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QuestionBankController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import({BankReportMapperImpl.class, JsonQuestionBankWriter.class})
@DisplayName("QuestionBankController")
class QuestionBankControllerTest {

    private static final String BASE_URL = "/api/v1/question-banks";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private QuestionBankService questionBankService;

    private static MockMultipartFile upload(String name) {
        return new MockMultipartFile("files", name, "application/json",
                "{\"questions\": []}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("POST /validate returns every violation without failing")
    void validate_returnsViolations() throws Exception {
        // Given
        List<QuestionCollection> sources = List.of(QuestionFixtures.allTypes());
        when(questionBankService.read(anyList())).thenReturn(sources);
        when(questionBankService.validate(sources)).thenReturn(List.of(
                new SourceViolation(0, 1, "Q2", ViolationKind.INVALID_BOOLEAN_ANSWER, "correct_answer", "bad")));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/validate").file(upload("a.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceCount").value(1))
                .andExpect(jsonPath("$.questionCount").value(6))
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.violations[0].kind").value("INVALID_BOOLEAN_ANSWER"))
                .andExpect(jsonPath("$.violations[0].questionId").value("Q2"));
    }

    @Test
    @DisplayName("POST /merge returns the merged bank and report")
    void merge_returnsBankAndReport() throws Exception {
        // Given
        QuestionCollection merged = QuestionFixtures.collection(
                QuestionFixtures.multipleChoice("Q1"), QuestionFixtures.trueFalse("Q1_1"));
        MergeReport report = new MergeReport(2, 2, 2, 1, List.of(
                new ConflictRecord(1, 0, "Q1", "Q1_1", 0.2, ConflictAssessment.DIFFERENT)), List.of());
        when(questionBankService.read(anyList())).thenReturn(List.of());
        when(questionBankService.merge(anyList())).thenReturn(new MergeResult(merged, report));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/merge").file(upload("a.json")).file(upload("b.json")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bank.questions[0].id").value("Q1"))
                .andExpect(jsonPath("$.bank.questions[1].id").value("Q1_1"))
                .andExpect(jsonPath("$.bank.questions[1].type").value("true_false"))
                .andExpect(jsonPath("$.report.collisionCount").value(1))
                .andExpect(jsonPath("$.report.conflicts[0].finalId").value("Q1_1"))
                .andExpect(jsonPath("$.report.conflicts[0].assessment").value("DIFFERENT"));
    }

    @Test
    @DisplayName("POST /merge with invalid questions returns 422 with violations")
    void merge_invalidQuestions_returns422() throws Exception {
        // Given
        when(questionBankService.read(anyList())).thenReturn(List.of());
        when(questionBankService.merge(anyList())).thenThrow(new QuestionValidationException(List.of(
                new SourceViolation(1, 0, "T1", ViolationKind.DELIMITER_IMBALANCE, "text", "Unclosed math delimiter at offset 8"))));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/merge").file(upload("a.json")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("Question Validation Failed"))
                .andExpect(jsonPath("$.violations[0].sourceIndex").value(1))
                .andExpect(jsonPath("$.violations[0].kind").value("DELIMITER_IMBALANCE"));
    }

    @Test
    @DisplayName("POST /merge with a malformed upload returns 400")
    void merge_malformedUpload_returns400() throws Exception {
        when(questionBankService.read(anyList()))
                .thenThrow(new StructuralException("Uploaded file 'a.json': Malformed JSON question bank"));

        mockMvc.perform(multipart(BASE_URL + "/merge").file(upload("a.json")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed Question Bank"))
                .andExpect(jsonPath("$.detail").value("Uploaded file 'a.json': Malformed JSON question bank"));
    }

    @Test
    @DisplayName("POST /export returns the package as an attachment with issue headers")
    void export_returnsAttachment() throws Exception {
        // Given
        byte[] csv = "id,type\nQ1,essay\n".getBytes(StandardCharsets.UTF_8);
        PackageResult result = new PackageResult(
                ExportFile.ofBytes("bank.csv", "text/csv; charset=utf-8", csv),
                List.of(new PackagingFailure(1, "Q2", "Unclosed math delimiter at offset 3")),
                List.of(new ExportIssue(ExportIssueCode.ROW_COUNT_MISMATCH, null, "CSV has 1 rows for 2 questions")));
        when(questionBankService.read(anyList())).thenReturn(List.of());
        when(questionBankService.export(anyList(), eq(ExportFormat.CSV), any(PackageOptions.class))).thenReturn(result);

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/export").file(upload("a.json"))
                        .param("format", "CSV")
                        .param("dialect", "MATHJAX_BRACKETS")
                        .param("title", "Bank"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"bank.csv\""))
                .andExpect(header().string("X-Export-Issues", "1"))
                .andExpect(header().string("X-Export-Skipped", "1"))
                .andExpect(content().bytes(csv));

        verify(questionBankService).read(anyList());
        verify(questionBankService).export(anyList(), eq(ExportFormat.CSV),
                eq(PackageOptions.builder().title("Bank").dialect(TargetDialect.MATHJAX_BRACKETS).build()));
        verifyNoMoreInteractions(questionBankService);
    }

    @Test
    @DisplayName("POST /export without format returns 400")
    void export_missingFormat_returns400() throws Exception {
        mockMvc.perform(multipart(BASE_URL + "/export").file(upload("a.json")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /export with unrenderable questions returns 422 with failed ids")
    void export_packagingFailure_returns422() throws Exception {
        // Given
        when(questionBankService.read(anyList())).thenReturn(List.of());
        when(questionBankService.export(anyList(), eq(ExportFormat.QTI_PACKAGE), any(PackageOptions.class)))
                .thenThrow(new PackagingException(List.of(new PackagingFailure(0, "Q9", "Correct answer does not match any choice"))));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/export").file(upload("a.json")).param("format", "QTI_PACKAGE"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.failedQuestionIds[0]").value("Q9"));
    }

    @Test
    @DisplayName("POST /export whose package fails the integrity check returns 500")
    void export_integrityFailure_returns500() throws Exception {
        // Given
        when(questionBankService.read(anyList())).thenReturn(List.of());
        when(questionBankService.export(anyList(), eq(ExportFormat.QTI_PACKAGE), any(PackageOptions.class)))
                .thenThrow(new ExportIntegrityException(List.of(ExportIssue.of(ExportIssueCode.MALFORMED_XML, "broken"))));

        // When / Then
        mockMvc.perform(multipart(BASE_URL + "/export").file(upload("a.json")).param("format", "QTI_PACKAGE"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.issues[0].code").value("MALFORMED_XML"));
    }
}
