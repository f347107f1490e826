package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;

/// Merge nodes need an explicit mode; with no parameters at all the runtime rejects them.
public class MergeConfigRule implements NodeRule {

    public static final String ID = "merge-config";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.MERGE);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        if (node.getParameters().isEmpty()) {
            return List.of(
                    context.error(
                            this, node, "Merge node has empty parameters - needs mode and numberInputs"));
        }
        if (!node.getParameters().has("mode")) {
            return List.of(
                    context.warning(
                            this,
                            node,
                            "Merge node missing 'mode' parameter (should usually be 'append')"));
        }
        return List.of();
    }
}
