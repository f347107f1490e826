package io.kairon.core.rule.node;

import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import io.kairon.core.workflow.node.Parameters;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Resolves sub-workflow calls against the project registry.
///
/// An `executeWorkflow` node references its target through a resource locator:
///
/// ```json
/// "workflowId": {"__rl": true, "mode": "list", "value": "42", "cachedResultName": "Query_DB"}
/// ```
///
/// Only `list` mode carries a name that survives an export/import between instances;
/// `id` and `url` modes embed instance-specific ids. The cached name is looked up in the
/// registry. Nodes sourcing the workflow from inline JSON, a file or a URL have no
/// reference to resolve.
public class SubWorkflowReferenceRule implements NodeRule {

    public static final String ID = "sub-workflow-reference";

    private static final String LIST_MODE = "list";
    private static final Set<String> INLINE_SOURCES = Set.of("parameter", "localFile", "url");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.EXECUTE_WORKFLOW);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        Parameters parameters = node.getParameters();
        String source = parameters.getString("source");
        if (source != null && INLINE_SOURCES.contains(source)) {
            return List.of();
        }

        Object reference = parameters.get("workflowId");
        if (isMissing(reference)) {
            return List.of(
                    context.error(this, node, "Execute Workflow missing workflowId configuration"));
        }
        if (reference instanceof String id) {
            return List.of(
                    context.warning(
                            this,
                            node,
                            "Execute Workflow references workflow by raw id '"
                                    + id
                                    + "' instead of 'list' mode (not portable)"));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, Object> locator = Parameters.asMap(reference);
        Object mode = locator.get("mode");
        if (!LIST_MODE.equals(mode)) {
            diagnostics.add(
                    context.warning(
                            this,
                            node,
                            "Execute Workflow using mode '"
                                    + mode
                                    + "' instead of 'list' (not portable)"));
        }

        if (locator.get("cachedResultName") instanceof String target && !target.isBlank()) {
            WorkflowRegistry registry = context.getRegistry();
            if (!registry.exists(target)) {
                diagnostics.add(
                        context.error(
                                this,
                                node,
                                "References workflow '" + target + "' which does not exist"));
            } else if (registry.isArchived(target)) {
                diagnostics.add(
                        context.warning(
                                this, node, "References archived workflow '" + target + "'"));
            }
        }
        return diagnostics;
    }

    private static boolean isMissing(Object reference) {
        if (reference == null) {
            return true;
        }
        if (reference instanceof String s) {
            return s.isBlank();
        }
        return reference instanceof Map<?, ?> map && map.isEmpty();
    }
}
