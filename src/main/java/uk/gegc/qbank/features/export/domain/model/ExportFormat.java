package uk.gegc.qbank.features.export.domain.model;

/**
 * Package formats an LMS can import.
 */
public enum ExportFormat {
    /**
     * Zip archive holding a QTI 1.2 assessment document, an IMS content package manifest and assessment metadata
     */
    QTI_PACKAGE,

    /**
     * Flat UTF-8 table with one row per question
     */
    CSV
}
