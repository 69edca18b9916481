package uk.gegc.qbank.features.bank.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockMultipartHttpServletRequestBuilder;
import uk.gegc.qbank.BaseIntegrationTest;
import uk.gegc.qbank.testsupport.ZipEntries;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Question bank API")
class QuestionBankApiIntegrationTest extends BaseIntegrationTest {

    private static final String BASE_URL = "/api/v1/question-banks";

    private static MockMultipartFile bank(String name) throws IOException {
        try (InputStream in = new ClassPathResource("banks/" + name).getInputStream()) {
            return new MockMultipartFile("files", name, "application/json", in.readAllBytes());
        }
    }

    private static MockMultipartHttpServletRequestBuilder upload(String path, String... banks) throws IOException {
        MockMultipartHttpServletRequestBuilder builder = multipart(BASE_URL + path);
        for (String name : banks) {
            builder.file(bank(name));
        }
        return builder;
    }

    @Test
    @DisplayName("validate: valid banks report no violations")
    void validate_validBanks() throws Exception {
        mockMvc.perform(upload("/validate", "algebra.json", "geometry.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sourceCount").value(2))
                .andExpect(jsonPath("$.questionCount").value(5))
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.violations").isEmpty());
    }

    @Test
    @DisplayName("validate: every invalid question is reported")
    void validate_invalidBank() throws Exception {
        mockMvc.perform(upload("/validate", "algebra.json", "invalid-answers.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.violations[*].sourceIndex").value(hasItems(1)))
                .andExpect(jsonPath("$.violations[*].questionId").value(hasItems("T1", "T2", "T3")))
                .andExpect(jsonPath("$.violations[*].kind").value(hasItems(
                        "INVALID_BOOLEAN_ANSWER",
                        "CORRECT_ANSWER_NOT_IN_CHOICES",
                        "DELIMITER_IMBALANCE",
                        "UNRECOGNIZED_TYPE")));
    }

    @Test
    @DisplayName("merge: colliding ids get the smallest free suffix and order is preserved")
    void merge_resolvesCollisions() throws Exception {
        mockMvc.perform(upload("/merge", "algebra.json", "geometry.json"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.bank.questions[0].id").value("Q1"))
                .andExpect(jsonPath("$.bank.questions[1].id").value("Q2"))
                .andExpect(jsonPath("$.bank.questions[2].id").value("Q3"))
                .andExpect(jsonPath("$.bank.questions[3].id").value("Q1_1"))
                .andExpect(jsonPath("$.bank.questions[3].type").value("short_answer"))
                .andExpect(jsonPath("$.bank.questions[4].id").value("Q4"))
                .andExpect(jsonPath("$.bank.questions[1].correct_answer").value("True"))
                .andExpect(jsonPath("$.report.sourceCount").value(2))
                .andExpect(jsonPath("$.report.totalIn").value(5))
                .andExpect(jsonPath("$.report.totalOut").value(5))
                .andExpect(jsonPath("$.report.collisionCount").value(1))
                .andExpect(jsonPath("$.report.conflicts[0].sourceIndex").value(1))
                .andExpect(jsonPath("$.report.conflicts[0].originalId").value("Q1"))
                .andExpect(jsonPath("$.report.conflicts[0].finalId").value("Q1_1"));
    }

    @Test
    @DisplayName("merge: an invalid source rejects the whole merge")
    void merge_invalidSource_returns422() throws Exception {
        mockMvc.perform(upload("/merge", "algebra.json", "invalid-answers.json"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.violations[*].questionId").value(hasItems("T1", "T2", "T3")));
    }

    @Test
    @DisplayName("merge: a file that is not JSON returns 400")
    void merge_notJson_returns400() throws Exception {
        MockMultipartFile broken = new MockMultipartFile("files", "broken.json", "application/json",
                "{\"questions\": [".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(multipart(BASE_URL + "/merge").file(bank("algebra.json")).file(broken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value(startsWith("Uploaded file 'broken.json'")));
    }

    @Test
    @DisplayName("merge: more sources than configured returns 400")
    void merge_tooManySources_returns400() throws Exception {
        mockMvc.perform(upload("/merge",
                        "algebra.json", "geometry.json", "algebra.json", "geometry.json", "algebra.json", "geometry.json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Cannot merge more than 5 question banks"));
    }

    @Test
    @DisplayName("export: QTI package contains a manifest and converted notation")
    void export_qtiPackage() throws Exception {
        MvcResult result = mockMvc.perform(upload("/export", "algebra.json", "geometry.json")
                        .param("format", "QTI_PACKAGE")
                        .param("title", "Midterm"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"Midterm.zip\""))
                .andExpect(header().string("X-Export-Issues", "0"))
                .andExpect(header().string("X-Export-Skipped", "0"))
                .andReturn();

        Map<String, String> entries = ZipEntries.read(result.getResponse().getContentAsByteArray());
        assertThat(entries).containsKeys("imsmanifest.xml", "Midterm.xml");
        assertThat(entries.get("Midterm.xml"))
                .contains("ident=\"Q1_1\"")
                .contains("\\(x + 2 = 5\\)")
                .doesNotContain("$x$");
    }

    @Test
    @DisplayName("export: CSV has one row per merged question")
    void export_csv() throws Exception {
        MvcResult result = mockMvc.perform(upload("/export", "algebra.json", "geometry.json")
                        .param("format", "CSV")
                        .param("filename", "merged"))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"merged.csv\""))
                .andExpect(header().string("X-Export-Issues", "0"))
                .andReturn();

        String csv = result.getResponse().getContentAsString(StandardCharsets.UTF_8);
        assertThat(csv.lines().filter(line -> !line.isBlank()).count()).isEqualTo(6);
        assertThat(csv).contains("Q1_1").contains("\\(x\\)");
    }

    @Test
    @DisplayName("export: unknown format returns 400")
    void export_unknownFormat_returns400() throws Exception {
        mockMvc.perform(upload("/export", "algebra.json").param("format", "PDF"))
                .andExpect(status().isBadRequest());
    }
}
