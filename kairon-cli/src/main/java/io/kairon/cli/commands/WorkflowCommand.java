package io.kairon.cli.commands;

import io.kairon.cli.ui.AnsiStyles;
import jakarta.inject.Inject;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import picocli.CommandLine.Option;

/// Base class for all workflow-related CLI commands.
///
/// Owns the banner, workflow directory resolution and color selection. Subclasses
/// implement {@link #execute()} and return the process exit code.
///
/// ### Workflow Directory Resolution
/// Priority order:
/// 1. CLI option `-d` / `--workflow-dir`
/// 2. Config property `kairon.workflow.dir`
/// 3. `n8n-workflows` in the current directory
///
/// ### Colors
/// ANSI colors are used unless `--no-color` is given or `kairon.lint.color` is `false`.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see WorkflowValidateCommand
/// @see WorkflowVisualizeCommand
public abstract class WorkflowCommand implements Callable<Integer> {

    static final String DEFAULT_WORKFLOW_DIR = "n8n-workflows";

    private static final String[] BANNER = {
        "",
        "  _          _",
        " | | ____ _ (_) _ __  ___   _ __",
        " | |/ / _` || || '__|/ _ \\ | '_ \\",
        " |   < (_| || || |  | (_) || | | |",
        " |_|\\_\\__,_||_||_|   \\___/ |_| |_|",
        "",
        " Workflow Graph Linter",
        ""
    };

    @Option(
            names = {"-d", "--workflow-dir"},
            description = "Directory containing the workflow JSON files")
    protected Path workflowDirPath;

    @Option(names = "--no-color", description = "Disable ANSI colors")
    protected boolean noColor;

    @Inject
    @ConfigProperty(name = "kairon.workflow.dir", defaultValue = DEFAULT_WORKFLOW_DIR)
    String defaultWorkflowDir;

    @Inject
    @ConfigProperty(name = "kairon.lint.color", defaultValue = "true")
    boolean colorEnabled;

    @Override
    public final Integer call() {
        if (showBanner()) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    /// Runs the command.
    ///
    /// @return process exit code
    protected abstract int execute();

    /// Whether the banner is printed before {@link #execute()}.
    protected boolean showBanner() {
        return true;
    }

    /// Returns the effective workflow directory.
    ///
    /// Resolution priority: CLI option `-d` > config property `kairon.workflow.dir` >
    /// `n8n-workflows`.
    ///
    /// @return workflow directory, never null; may not exist
    protected Path getWorkflowDirectory() {
        if (workflowDirPath != null) {
            return workflowDirPath;
        }
        if (defaultWorkflowDir != null && !defaultWorkflowDir.isBlank()) {
            return Path.of(defaultWorkflowDir);
        }
        return Path.of(DEFAULT_WORKFLOW_DIR);
    }

    /// Resolves a workflow file argument.
    ///
    /// The argument is taken as a path first; if no such file exists it is looked up in
    /// the workflow directory, with `.json` appended when it has no extension.
    ///
    /// @param argument file path or workflow file name, not null
    /// @return resolved path, the argument itself if no candidate exists
    protected Path resolveWorkflowFile(String argument) {
        Path direct = Path.of(argument);
        if (Files.isRegularFile(direct)) {
            return direct;
        }
        Path inDirectory = getWorkflowDirectory().resolve(argument);
        if (Files.isRegularFile(inDirectory)) {
            return inDirectory;
        }
        if (!argument.endsWith(".json")) {
            Path withExtension = getWorkflowDirectory().resolve(argument + ".json");
            if (Files.isRegularFile(withExtension)) {
                return withExtension;
            }
        }
        return direct;
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(colorEnabled && !noColor);
    }
}
