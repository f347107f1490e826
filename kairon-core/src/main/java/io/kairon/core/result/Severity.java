package io.kairon.core.result;

/// Severity of a diagnostic. Only errors fail a document.
public enum Severity {
    ERROR("ERROR"),
    WARNING("WARN"),
    INFO("INFO");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    /// @return short label used in reports
    public String label() {
        return label;
    }
}
