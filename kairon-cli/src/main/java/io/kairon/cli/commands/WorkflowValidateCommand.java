package io.kairon.cli.commands;

import io.kairon.cli.report.ValidationReportRenderer;
import io.kairon.cli.validation.FileReport;
import io.kairon.cli.validation.WorkflowValidationService;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.ValidationSummary;
import io.kairon.serialization.WorkflowFiles;
import io.kairon.serialization.WorkflowRegistryLoader;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import picocli.CommandLine;

/// CLI command validating workflow documents, designed as a CI gate.
///
/// Without a path, every top-level `*.json` file of the workflow directory is validated;
/// with a path, only that file. The project registry is always built from the workflow
/// directory, so cross-workflow references resolve in both modes.
///
/// ### Exit Codes
/// - `0` - no errors (warnings allowed unless `--strict`)
/// - `1` - at least one error, or nothing to validate
/// - `2` - warnings only, with `--strict`
///
/// ### Usage
/// ```bash
/// kairon validate [path] [--strict] [--fix] [-d <workflow-dir>] [-q] [--no-color]
/// ```
///
/// @see WorkflowValidationService
/// @see ValidationReportRenderer
@CommandLine.Command(name = "validate", description = "Validate workflow graphs and conventions")
class WorkflowValidateCommand extends WorkflowCommand {

    @CommandLine.Parameters(
            index = "0",
            description = "Workflow file (default: all *.json files in the workflow directory)",
            arity = "0..1")
    String workflowPath;

    @CommandLine.Option(names = "--strict", description = "Exit with code 2 on warnings")
    boolean strict;

    @CommandLine.Option(
            names = "--fix",
            description = "Remove dead nodes and their connections, then re-validate")
    boolean fix;

    @CommandLine.Option(
            names = {"-q", "--quiet"},
            description = "Only print failing workflows, their errors and the summary")
    boolean quiet;

    @Inject WorkflowValidationService validationService;

    @Override
    protected boolean showBanner() {
        return !quiet;
    }

    @Override
    protected int execute() {
        Path workflowDir = getWorkflowDirectory();
        try {
            List<Path> files;
            if (workflowPath != null && !workflowPath.isBlank()) {
                files = List.of(resolveWorkflowFile(workflowPath));
            } else {
                if (!Files.isDirectory(workflowDir)) {
                    System.err.println(" [FAIL] Workflow directory not found: " + workflowDir);
                    return ValidationSummary.EXIT_ERRORS;
                }
                files = WorkflowFiles.list(workflowDir);
                if (files.isEmpty()) {
                    System.err.println(" [FAIL] No workflow files found in " + workflowDir);
                    return ValidationSummary.EXIT_ERRORS;
                }
            }

            WorkflowRegistry registry = WorkflowRegistryLoader.build(workflowDir);
            List<FileReport> reports = validationService.validateAll(files, registry, fix);

            System.out.print(new ValidationReportRenderer(styles(), quiet).render(reports));
            return ValidationSummary.of(reports.stream().map(FileReport::result).toList())
                    .exitCode(strict);
        } catch (IOException e) {
            System.err.println(" [FAIL] Validation failed: " + e.getMessage());
            return ValidationSummary.EXIT_ERRORS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println(" [FAIL] Validation interrupted");
            return ValidationSummary.EXIT_ERRORS;
        }
    }
}
