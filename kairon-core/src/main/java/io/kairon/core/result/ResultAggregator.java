package io.kairon.core.result;

import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.workflow.WorkflowDocument;
import java.util.List;

/// Combines reachability facts and rule findings into the result of one document.
///
/// A non-empty dead set becomes a single error naming every dead node, sorted. A
/// document without errors and warnings gets an informational success note.
public class ResultAggregator {

    public static final String DEAD_CODE_RULE_ID = "dead-code";
    public static final String SUMMARY_RULE_ID = "summary";

    /// Builds the result of one document.
    ///
    /// @param document analyzed document, not null
    /// @param workflowName display name, not null
    /// @param source file name the document was read from, may be null
    /// @param analysis reachability analysis of the document, not null
    /// @param ruleDiagnostics findings of the rule engine, not null
    /// @return result, never null
    public ValidationResult aggregate(
            WorkflowDocument document,
            String workflowName,
            String source,
            GraphAnalysis analysis,
            List<Diagnostic> ruleDiagnostics) {
        ValidationResult.Builder builder =
                ValidationResult.builder(workflowName).source(source).deadNodes(analysis.deadNodes());

        if (analysis.hasDeadCode()) {
            builder.add(
                    Diagnostic.error(
                            DEAD_CODE_RULE_ID, workflowName, deadCodeMessage(analysis)));
        }
        builder.addAll(analysis.diagnostics());
        builder.addAll(ruleDiagnostics);

        ValidationResult result = builder.build();
        if (result.passed() && !result.hasWarnings()) {
            return result.withDiagnostic(
                    Diagnostic.info(
                            SUMMARY_RULE_ID,
                            workflowName,
                            "All " + document.getNodes().size() + " nodes validated successfully"));
        }
        return result;
    }

    static String deadCodeMessage(GraphAnalysis analysis) {
        return "DEAD CODE: "
                + analysis.deadNodes().size()
                + " node(s) unreachable from triggers: "
                + String.join(", ", analysis.deadNodes());
    }
}
