package io.kairon.core.result;

import java.util.Collection;

/// Totals over many validation results, and the CI exit-code policy derived from them.
///
/// @param documents number of documents analyzed
/// @param errors total error count
/// @param warnings total warning count
/// @param failed number of documents with at least one error
public record ValidationSummary(int documents, int errors, int warnings, int failed) {

    /// Everything passed, or only warnings without strict gating.
    public static final int EXIT_OK = 0;

    /// At least one error.
    public static final int EXIT_ERRORS = 1;

    /// No errors, but warnings under strict gating.
    public static final int EXIT_WARNINGS = 2;

    public static ValidationSummary empty() {
        return new ValidationSummary(0, 0, 0, 0);
    }

    /// Sums the counts of the given results.
    ///
    /// @param results per-document results, not null
    /// @return summary, never null
    public static ValidationSummary of(Collection<ValidationResult> results) {
        return results.stream()
                .map(ValidationSummary::of)
                .reduce(empty(), ValidationSummary::plus);
    }

    public static ValidationSummary of(ValidationResult result) {
        return new ValidationSummary(
                1,
                result.getErrors().size(),
                result.getWarnings().size(),
                result.passed() ? 0 : 1);
    }

    public ValidationSummary plus(ValidationSummary other) {
        return new ValidationSummary(
                documents + other.documents,
                errors + other.errors,
                warnings + other.warnings,
                failed + other.failed);
    }

    /// Maps the totals to a process exit code.
    ///
    /// @param strict whether warnings fail the gate
    /// @return [#EXIT_ERRORS] if any error, [#EXIT_WARNINGS] if strict and any warning,
    ///     [#EXIT_OK] otherwise
    public int exitCode(boolean strict) {
        if (errors > 0) {
            return EXIT_ERRORS;
        }
        if (strict && warnings > 0) {
            return EXIT_WARNINGS;
        }
        return EXIT_OK;
    }
}
