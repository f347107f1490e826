package io.kairon.core;

import io.kairon.core.fix.DeadCodeFixer;
import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.graph.GraphAnalyzer;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.ResultAggregator;
import io.kairon.core.result.ValidationResult;
import io.kairon.core.rule.DefaultRuleEngine;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.rule.RuleEngine;
import io.kairon.core.workflow.WorkflowDocument;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Entry point for linting workflow documents.
///
/// Runs reachability analysis and the rule engine over a document and aggregates their
/// findings. Archived documents are not analyzed.
///
/// ### Usage
/// {@snippet :
/// WorkflowLinter linter = new WorkflowLinter(LinterConfig.defaults());
/// ValidationResult result = linter.lint(document, registry, "order_flow.json");
/// if (!result.passed()) {
///     WorkflowDocument fixed = linter.fix(document, result.getDeadNodes());
/// }
/// }
///
/// @implNote Thread-safe once constructed. Every call works on its own document and
/// returns a new result; the registry is only read.
///
/// @see LinterConfig for configurable conventions
/// @see RuleEngine for custom rules
public class WorkflowLinter {

    public static final String ARCHIVED_RULE_ID = "archived";
    public static final String ARCHIVED_MESSAGE = "Workflow is archived - skipping validation";

    private static final Logger logger = Logger.getLogger(WorkflowLinter.class.getName());

    private final GraphAnalyzer graphAnalyzer;
    private final RuleEngine ruleEngine;
    private final ResultAggregator aggregator;
    private final DeadCodeFixer fixer;

    public WorkflowLinter() {
        this(LinterConfig.defaults());
    }

    public WorkflowLinter(LinterConfig config) {
        this(
                new GraphAnalyzer(config.getReachabilityPolicy()),
                new DefaultRuleEngine(config),
                new ResultAggregator(),
                new DeadCodeFixer());
    }

    public WorkflowLinter(
            GraphAnalyzer graphAnalyzer,
            RuleEngine ruleEngine,
            ResultAggregator aggregator,
            DeadCodeFixer fixer) {
        this.graphAnalyzer = Objects.requireNonNull(graphAnalyzer, "graphAnalyzer required");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine required");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator required");
        this.fixer = Objects.requireNonNull(fixer, "fixer required");
    }

    /// Lints one document.
    ///
    /// @param document document to lint, not null
    /// @param registry project registry for cross-workflow checks, not null
    /// @param source file name the document was read from; its stem names documents
    ///     without a `name`, not null
    /// @return result, never null
    public ValidationResult lint(
            WorkflowDocument document, WorkflowRegistry registry, String source) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(source, "source must not be null");

        String workflowName = document.displayName(stem(source));
        if (document.isArchived()) {
            logger.fine(() -> "Skipping archived workflow: " + workflowName);
            return ValidationResult.builder(workflowName)
                    .source(source)
                    .add(Diagnostic.info(ARCHIVED_RULE_ID, workflowName, ARCHIVED_MESSAGE))
                    .build();
        }

        GraphAnalysis analysis = graphAnalyzer.findDeadCode(document, workflowName);
        List<Diagnostic> diagnostics =
                ruleEngine.evaluate(new RuleContext(document, registry, workflowName));
        return aggregator.aggregate(document, workflowName, source, analysis, diagnostics);
    }

    /// Analyzes reachability only.
    ///
    /// @param document document to analyze, not null
    /// @return analysis, never null
    public GraphAnalysis analyze(WorkflowDocument document) {
        return graphAnalyzer.findDeadCode(document, document.displayName("workflow"));
    }

    /// Removes the given dead nodes and their connections.
    ///
    /// @param document document to fix, not null
    /// @param deadNodes node names to remove, not null
    /// @return fixed document, never null
    public WorkflowDocument fix(WorkflowDocument document, Set<String> deadNodes) {
        return fixer.fix(document, deadNodes);
    }

    public RuleEngine getRuleEngine() {
        return ruleEngine;
    }

    /// Strips directories and the `.json` extension from a file name.
    ///
    /// @param source file name or path, not null
    /// @return file stem
    public static String stem(String source) {
        int separator = Math.max(source.lastIndexOf('/'), source.lastIndexOf('\\'));
        String fileName = source.substring(separator + 1);
        return fileName.endsWith(".json")
                ? fileName.substring(0, fileName.length() - ".json".length())
                : fileName;
    }
}
