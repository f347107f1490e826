package io.kairon.cli.commands;

import io.kairon.cli.visualizer.WorkflowVisualizer;
import io.kairon.core.WorkflowLinter;
import io.kairon.core.exception.WorkflowNotFoundException;
import io.kairon.core.exception.WorkflowParseException;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.serialization.WorkflowSerializer;
import jakarta.inject.Inject;
import picocli.CommandLine;

/// CLI command rendering the connection graph of one workflow, with dead nodes marked.
///
/// ### Usage
/// ```bash
/// kairon visualize <path> [--format text|mermaid] [-d <workflow-dir>] [--no-color]
/// ```
@CommandLine.Command(name = "visualize", description = "Visualize a workflow's connection graph")
class WorkflowVisualizeCommand extends WorkflowCommand {

    @CommandLine.Parameters(index = "0", description = "Workflow file")
    String workflowPath;

    @CommandLine.Option(
            names = "--format",
            defaultValue = WorkflowVisualizer.DEFAULT_FORMAT,
            description = "Output format: text, mermaid")
    String format;

    @Inject WorkflowVisualizer visualizer;

    @Inject WorkflowLinter linter;

    @Override
    protected int execute() {
        try {
            WorkflowDocument document = WorkflowSerializer.read(resolveWorkflowFile(workflowPath));
            System.out.println(
                    visualizer.visualize(document, linter.analyze(document), format, styles()));
            return 0;
        } catch (WorkflowNotFoundException | WorkflowParseException | IllegalArgumentException e) {
            System.err.println(" [FAIL] Visualization failed: " + e.getMessage());
            return 1;
        }
    }
}
