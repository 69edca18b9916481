package uk.gegc.qbank.features.export.application;

import uk.gegc.qbank.features.export.domain.model.ExportFormat;
import uk.gegc.qbank.features.export.domain.model.ExportPayload;
import uk.gegc.qbank.features.export.domain.model.RenderedPackage;

/**
 * SPI for rendering a question collection into a downloadable package.
 */
public interface ExportRenderer {
    boolean supports(ExportFormat format);

    RenderedPackage render(ExportPayload payload);
}
