package uk.gegc.qbank.features.export.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.export.application.ExportInspector;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportIssue;
import uk.gegc.qbank.features.export.domain.model.ExportIssueCode;
import uk.gegc.qbank.features.export.infra.CsvQuestionColumns;
import uk.gegc.qbank.features.export.infra.CsvQuestionTableReader;
import uk.gegc.qbank.features.question.domain.model.QuestionCollection;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CsvPackageInspector implements ExportInspector {

    private final CsvQuestionTableReader tableReader;

    @Override
    public boolean supports(ExportFormat format) {
        return format == ExportFormat.CSV;
    }

    @Override
    public List<ExportIssue> inspect(byte[] content, QuestionCollection source) {
        List<ExportIssue> issues = new ArrayList<>();

        List<Map<String, String>> rows;
        try {
            rows = tableReader.readRows(content);
        } catch (IOException | RuntimeException e) {
            issues.add(ExportIssue.of(ExportIssueCode.MALFORMED_CSV, "CSV package cannot be parsed: " + e.getMessage()));
            return issues;
        }

        if (rows.size() != source.size()) {
            issues.add(ExportIssue.of(ExportIssueCode.ROW_COUNT_MISMATCH,
                    "CSV has " + rows.size() + " rows for " + source.size() + " questions"));
        }

        for (int i = 0; i < rows.size(); i++) {
            String id = rows.get(i).get(CsvQuestionColumns.ID);
            if (id == null || id.isBlank()) {
                // data rows are numbered from 1, after the header
                issues.add(ExportIssue.of(ExportIssueCode.MISSING_ID_COLUMN, "Row " + (i + 1) + " has no id"));
            }
        }
        return issues;
    }
}
