package uk.gegc.qbank.features.bank.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.core.io.InputStreamResource;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qbank.features.bank.api.dto.MergeResponse;
import uk.gegc.qbank.features.bank.api.dto.PackageExportRequest;
import uk.gegc.qbank.features.bank.api.dto.ValidationResponse;
import uk.gegc.qbank.features.bank.application.QuestionBankService;
import uk.gegc.qbank.features.bank.application.io.QuestionBankWriter;
import uk.gegc.qbank.features.bank.infra.mapping.BankReportMapper;
import uk.gegc.qbank.features.export.domain.model.ExportFile;
import uk.gegc.qbank.features.export.domain.model.PackageResult;
import uk.gegc.qbank.features.merge.domain.model.MergeResult;
import uk.gegc.qbank.features.merge.domain.model.SourceViolation;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.util.List;

@Tag(name = "Question Banks", description = "Validate, merge and package portable question bank files for LMS import.")
@RestController
@RequestMapping("/api/v1/question-banks")
@RequiredArgsConstructor
@Validated
@Slf4j
public class QuestionBankController {

    static final String EXPORT_ISSUES_HEADER = "X-Export-Issues";
    static final String EXPORT_SKIPPED_HEADER = "X-Export-Skipped";

    private final QuestionBankService questionBankService;
    private final QuestionBankWriter questionBankWriter;
    private final BankReportMapper reportMapper;

    @Operation(
            summary = "Validate question banks",
            description = "Checks every question of every uploaded bank and lists all violations. Never fails because of invalid questions.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Validation completed",
                            content = @Content(schema = @Schema(implementation = ValidationResponse.class))),
                    @ApiResponse(responseCode = "400", description = "An upload is not a question bank",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @PostMapping(value = "/validate", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ValidationResponse> validate(@RequestParam("files") List<MultipartFile> files) {
        List<QuestionCollection> sources = questionBankService.read(files);
        List<SourceViolation> violations = questionBankService.validate(sources);
        int questionCount = sources.stream().mapToInt(QuestionCollection::size).sum();
        return ResponseEntity.ok(new ValidationResponse(
                sources.size(),
                questionCount,
                violations.isEmpty(),
                reportMapper.toViolationDtos(violations)
        ));
    }

    @Operation(
            summary = "Merge question banks",
            description = "Validates all uploads, renames colliding ids with the smallest free numeric suffix and concatenates the banks in upload order.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Merged bank and merge report",
                            content = @Content(schema = @Schema(implementation = MergeResponse.class))),
                    @ApiResponse(responseCode = "400", description = "An upload is not a question bank",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
                    @ApiResponse(responseCode = "422", description = "At least one question is invalid; nothing was merged",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @PostMapping(value = "/merge", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<MergeResponse> merge(@RequestParam("files") List<MultipartFile> files) {
        MergeResult result = questionBankService.merge(questionBankService.read(files));
        return ResponseEntity.ok(new MergeResponse(
                questionBankWriter.toJson(result.collection()),
                reportMapper.toDto(result.report())
        ));
    }

    @Operation(
            summary = "Export question banks as an LMS package",
            description = "Merges the uploads, converts math notation to the target dialect and builds a QTI archive or CSV table. "
                    + "The number of advisory integrity issues is returned in the X-Export-Issues header.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Package file"),
                    @ApiResponse(responseCode = "400", description = "Invalid upload or parameters",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
                    @ApiResponse(responseCode = "422", description = "Invalid questions or questions that cannot be packaged",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
                    @ApiResponse(responseCode = "500", description = "The built package failed its integrity check",
                            content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
            }
    )
    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Resource> export(
            @RequestParam("files") List<MultipartFile> files,
            @ParameterObject @ModelAttribute @Valid PackageExportRequest request
    ) {
        List<QuestionCollection> sources = questionBankService.read(files);
        PackageResult result = questionBankService.export(sources, request.format(), request.toOptions());

        ExportFile exportFile = result.file();
        if (!result.failures().isEmpty()) {
            log.warn("Export skipped {} question(s): file={}", result.failures().size(), exportFile.filename());
        }

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFile.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + exportFile.filename() + "\"")
                .header(EXPORT_ISSUES_HEADER, String.valueOf(result.issues().size()))
                .header(EXPORT_SKIPPED_HEADER, String.valueOf(result.failures().size()));
        if (exportFile.contentLength() >= 0) {
            response.contentLength(exportFile.contentLength());
        }
        return response.body(new InputStreamResource(exportFile.contentSupplier().get()));
    }
}
