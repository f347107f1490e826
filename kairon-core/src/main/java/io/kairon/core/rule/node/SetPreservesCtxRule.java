package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import io.kairon.core.workflow.node.Parameters;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// A Set node assigning `ctx.*` fields drops the rest of the item unless
/// `includeOtherFields` is on.
///
/// Partial objects feeding a merge node are intentional and not flagged.
public class SetPreservesCtxRule implements NodeRule {

    public static final String ID = "set-preserves-ctx";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.SET);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        Parameters parameters = node.getParameters();
        if (parameters.getBoolean("includeOtherFields", false) || !setsCtx(parameters)) {
            return List.of();
        }

        boolean feedsMerge =
                context.getDocument().getConnections().mainTargets(node.getName()).stream()
                        .map(context::findNode)
                        .flatMap(Optional::stream)
                        .anyMatch(target -> NodeTypes.MERGE.equals(target.getSimpleType()));
        if (feedsMerge) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        node,
                        "sets ctx.* fields but includeOtherFields is false - may lose ctx data"));
    }

    /// @return true if any assignment targets a `ctx.` path
    public static boolean setsCtx(Parameters parameters) {
        return parameters.getList("assignments.assignments").stream()
                .map(a -> Parameters.asMap(a).get("name"))
                .anyMatch(name -> name instanceof String s && s.contains("ctx."));
    }
}
