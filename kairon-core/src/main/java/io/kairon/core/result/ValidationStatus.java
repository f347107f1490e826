package io.kairon.core.result;

/// Overall outcome of one document.
public enum ValidationStatus {
    /// No errors and no warnings.
    PASS,
    /// No errors, at least one warning.
    WARN,
    /// At least one error.
    FAIL
}
