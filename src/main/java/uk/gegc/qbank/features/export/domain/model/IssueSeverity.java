package uk.gegc.qbank.features.export.domain.model;

public enum IssueSeverity {
    WARNING,
    FATAL
}
