package uk.gegc.qbank.features.export.infra;

import org.springframework.stereotype.Component;
import uk.gegc.qbank.features.export.domain.model.ExportFormat;

@Component
public class ExportMediaTypeResolver {
    public String contentTypeFor(ExportFormat format) {
        return switch (format) {
            case QTI_PACKAGE -> "application/zip";
            case CSV -> "text/csv; charset=utf-8";
        };
    }

    public String fileExtensionFor(ExportFormat format) {
        return switch (format) {
            case QTI_PACKAGE -> "zip";
            case CSV -> "csv";
        };
    }
}
