package io.kairon.cli.validation;

import io.kairon.core.WorkflowLinter;
import io.kairon.core.exception.WorkflowNotFoundException;
import io.kairon.core.exception.WorkflowParseException;
import io.kairon.core.exception.WorkflowWriteException;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.ValidationResult;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.serialization.WorkflowSerializer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/// Runs the per-file validation pipeline over a set of workflow files.
///
/// ### Pipeline
/// 1. Read and parse the file. A parse or not-found failure becomes the single error of
///    that file; other files are unaffected.
/// 2. Lint the document against the shared registry.
/// 3. With auto-fix enabled and dead nodes found: remove them, write the file back, then
///    re-read and re-validate it. The re-validation is what gets reported. A failed
///    write is reported as an error of that file.
///
/// ### Concurrency
/// Files are processed on a fixed thread pool of `kairon.lint.parallelism` workers
/// (`0` means one per available processor). Each file is read, fixed and written by
/// exactly one task. Reports are returned in input order regardless of completion order.
///
/// @implNote Thread-safe. The registry and linter are shared read-only between tasks.
@ApplicationScoped
public class WorkflowValidationService {

    public static final String PARSE_RULE_ID = "parse";
    public static final String FIX_RULE_ID = "auto-fix";

    private static final Logger logger =
            Logger.getLogger(WorkflowValidationService.class.getName());

    private final WorkflowLinter linter;
    private final int parallelism;

    @Inject
    public WorkflowValidationService(
            WorkflowLinter linter,
            @ConfigProperty(name = "kairon.lint.parallelism", defaultValue = "0") int parallelism) {
        this.linter = Objects.requireNonNull(linter, "linter must not be null");
        if (parallelism < 0) {
            throw new IllegalArgumentException("parallelism must be >= 0: " + parallelism);
        }
        this.parallelism = parallelism;
    }

    /// Validates files in parallel.
    ///
    /// @param files workflow files, not null
    /// @param registry project registry, not null
    /// @param fix whether to remove dead nodes and rewrite the files
    /// @return one report per file in input order, never null
    /// @throws InterruptedException if interrupted while waiting for the workers
    public List<FileReport> validateAll(List<Path> files, WorkflowRegistry registry, boolean fix)
            throws InterruptedException {
        if (files.size() <= 1) {
            List<FileReport> reports = new ArrayList<>();
            for (Path file : files) {
                reports.add(validate(file, registry, fix));
            }
            return reports;
        }

        int threads = Math.min(files.size(), effectiveParallelism());
        logger.fine(() -> "Validating " + files.size() + " files on " + threads + " threads");

        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<FileReport>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(pool.submit(() -> validate(file, registry, fix)));
            }
            List<FileReport> reports = new ArrayList<>(futures.size());
            for (Future<FileReport> future : futures) {
                reports.add(await(future));
            }
            return reports;
        } finally {
            pool.shutdownNow();
        }
    }

    /// Validates a single file, applying the auto-fix when requested.
    ///
    /// @param file workflow file, not null
    /// @param registry project registry, not null
    /// @param fix whether to remove dead nodes and rewrite the file
    /// @return report, never null
    public FileReport validate(Path file, WorkflowRegistry registry, boolean fix) {
        String source = file.getFileName().toString();
        String fallbackName = WorkflowLinter.stem(source);

        WorkflowDocument document;
        try {
            document = WorkflowSerializer.read(file);
        } catch (WorkflowNotFoundException | WorkflowParseException e) {
            return FileReport.of(
                    file,
                    ValidationResult.failure(
                            fallbackName,
                            source,
                            Diagnostic.error(PARSE_RULE_ID, fallbackName, e.getMessage())));
        }

        ValidationResult result = linter.lint(document, registry, source);
        if (!fix || result.getDeadNodes().isEmpty()) {
            return FileReport.of(file, result);
        }
        return fixAndRevalidate(file, document, result, registry);
    }

    private FileReport fixAndRevalidate(
            Path file, WorkflowDocument document, ValidationResult result, WorkflowRegistry registry) {
        SortedSet<String> dead = result.getDeadNodes();
        try {
            WorkflowSerializer.write(linter.fix(document, dead), file);
        } catch (WorkflowWriteException e) {
            logger.warning("Auto-fix of " + file + " failed: " + e.getMessage());
            return FileReport.of(
                    file,
                    result.withDiagnostic(
                            Diagnostic.error(
                                    FIX_RULE_ID,
                                    result.getWorkflowName(),
                                    "Auto-fix failed: " + e.getMessage())));
        }
        logger.info("Removed " + dead.size() + " dead node(s) from " + file + ": " + dead);

        try {
            ValidationResult revalidated =
                    linter.lint(WorkflowSerializer.read(file), registry, result.getSource());
            return new FileReport(file, revalidated, dead);
        } catch (WorkflowNotFoundException | WorkflowParseException e) {
            return new FileReport(
                    file,
                    ValidationResult.failure(
                            result.getWorkflowName(),
                            result.getSource(),
                            Diagnostic.error(
                                    FIX_RULE_ID,
                                    result.getWorkflowName(),
                                    "Fixed file could not be re-read: " + e.getMessage())),
                    dead);
        }
    }

    private int effectiveParallelism() {
        return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
    }

    private static FileReport await(Future<FileReport> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Validation task failed", cause);
        }
    }
}
