package io.kairon.cli.report;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.cli.validation.FileReport;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.ValidationResult;
import io.kairon.core.result.ValidationStatus;
import io.kairon.core.result.ValidationSummary;
import java.util.List;

/// Renders validation reports as terminal text.
///
/// ### Layout
/// One block per file, in the order given:
/// ```
/// [FAIL] Order_Flow (1 errors, 0 warnings)
///    ERROR dead-code: DEAD CODE: 1 node(s) unreachable from triggers: B
/// ```
/// Errors come before warnings, and infos follow (at most [#MAX_INFOS] per file). A
/// summary with file, error and warning counts closes the report.
///
/// In quiet mode only failing files and their errors are listed, followed by the summary.
public class ValidationReportRenderer {

    static final int MAX_INFOS = 5;
    private static final int SEPARATOR_WIDTH = 62;

    private final AnsiStyles styles;
    private final boolean quiet;

    public ValidationReportRenderer(AnsiStyles styles, boolean quiet) {
        this.styles = styles;
        this.quiet = quiet;
    }

    /// Renders the full report.
    ///
    /// @param reports per-file reports in display order, not null
    /// @return report text ending with a line separator, never null
    public String render(List<FileReport> reports) {
        StringBuilder sb = new StringBuilder();
        for (FileReport report : reports) {
            if (quiet && report.result().passed()) {
                continue;
            }
            renderFile(sb, report);
        }
        renderSummary(sb, ValidationSummary.of(reports.stream().map(FileReport::result).toList()));
        return sb.toString();
    }

    private void renderFile(StringBuilder sb, FileReport report) {
        ValidationResult result = report.result();
        sb.append(
                String.format(
                        "%s %s (%d errors, %d warnings)%n",
                        styles.status(result.getStatus()),
                        styles.bold(result.getWorkflowName()),
                        result.getErrors().size(),
                        result.getWarnings().size()));

        result.getErrors().forEach(diagnostic -> renderDiagnostic(sb, diagnostic));
        if (!quiet) {
            result.getWarnings().forEach(diagnostic -> renderDiagnostic(sb, diagnostic));
            renderInfos(sb, result.getInfos());
        }
        if (report.fixed()) {
            sb.append(
                    String.format(
                            "   %s Auto-fix removed %d node(s): %s%n",
                            styles.checkmark(),
                            report.removedNodes().size(),
                            String.join(", ", report.removedNodes())));
        }
    }

    private void renderInfos(StringBuilder sb, List<Diagnostic> infos) {
        infos.stream().limit(MAX_INFOS).forEach(diagnostic -> renderDiagnostic(sb, diagnostic));
        if (infos.size() > MAX_INFOS) {
            sb.append(
                    String.format(
                            "   %s%n",
                            styles.dim("... and " + (infos.size() - MAX_INFOS) + " more")));
        }
    }

    private void renderDiagnostic(StringBuilder sb, Diagnostic diagnostic) {
        String label = String.format("%-5s", diagnostic.severity().label());
        sb.append(
                String.format(
                        "   %s %s %s%n",
                        styles.severity(diagnostic.severity(), label),
                        styles.gray(diagnostic.ruleId() + ":"),
                        diagnostic.message()));
    }

    private void renderSummary(StringBuilder sb, ValidationSummary summary) {
        sb.append(styles.separator(SEPARATOR_WIDTH)).append(System.lineSeparator());
        sb.append(
                String.format(
                        "Validated %d file(s): %d errors, %d warnings%n",
                        summary.documents(), summary.errors(), summary.warnings()));

        if (summary.failed() > 0) {
            sb.append(
                    String.format(
                            "%s %d workflow(s) failed validation%n",
                            styles.status(ValidationStatus.FAIL),
                            summary.failed()));
        } else if (summary.warnings() > 0) {
            sb.append(
                    String.format(
                            "%s All workflows passed with warnings%n",
                            styles.status(ValidationStatus.WARN)));
        } else {
            sb.append(
                    String.format(
                            "%s All workflows passed%n", styles.status(ValidationStatus.PASS)));
        }
    }
}
