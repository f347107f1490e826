package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;

/// Flags sub-workflow triggers with empty parameters, which the runtime editor rejects.
public class EmptyTriggerRule implements NodeRule {

    public static final String ID = "empty-trigger";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.EXECUTE_WORKFLOW_TRIGGER);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        if (!node.getParameters().isEmpty()) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        node,
                        "executeWorkflowTrigger has empty parameters"
                                + " (n8n will show validation error)"));
    }
}
