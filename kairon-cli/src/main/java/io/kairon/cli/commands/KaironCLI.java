package io.kairon.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Kairon CLI application.
///
/// Registers the subcommands:
/// - `validate` - Lint one workflow file or the whole workflow directory (CI gate)
/// - `visualize` - Render a workflow's connection graph as text or Mermaid
///
/// @see WorkflowValidateCommand
/// @see WorkflowVisualizeCommand
@TopCommand
@Command(
        name = "kairon",
        description = "Kairon workflow graph linter",
        mixinStandardHelpOptions = true,
        version = "kairon 0.1.0",
        subcommands = {WorkflowValidateCommand.class, WorkflowVisualizeCommand.class})
public class KaironCLI {}
