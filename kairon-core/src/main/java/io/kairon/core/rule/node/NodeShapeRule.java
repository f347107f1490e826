package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Checks the properties every node needs to be imported by the runtime.
public class NodeShapeRule implements NodeRule {

    public static final String ID = "node-shape";

    static final List<String> REQUIRED_PROPERTIES =
            List.of(Node.PARAMETERS, Node.TYPE, Node.TYPE_VERSION, Node.POSITION);

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of();
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String property : REQUIRED_PROPERTIES) {
            if (!node.has(property)) {
                diagnostics.add(
                        context.error(this, node, "missing required property '" + property + "'"));
            }
        }

        String type = node.getType();
        if (type != null && !NodeTypes.isNamespaced(type)) {
            diagnostics.add(context.warning(this, node, "unusual type format '" + type + "'"));
        }

        if (node.has(Node.POSITION) && !isPosition(node.getAttributes().get(Node.POSITION))) {
            diagnostics.add(context.error(this, node, "invalid position format"));
        }
        return diagnostics;
    }

    private static boolean isPosition(Object value) {
        return value instanceof List<?> list
                && list.size() == 2
                && list.stream().allMatch(Number.class::isInstance);
    }
}
