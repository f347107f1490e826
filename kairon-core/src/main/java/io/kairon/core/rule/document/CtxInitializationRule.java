package io.kairon.core.rule.document;

import io.kairon.core.graph.ReachabilityPolicy;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.DocumentRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.rule.node.SetPreservesCtxRule;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Notes where the context object is created: the node right after the first trigger.
///
/// Informational only; workflows without a ctx-creating node are not flagged.
public class CtxInitializationRule implements DocumentRule {

    public static final String ID = "ctx-initialization";

    private final ReachabilityPolicy policy;

    public CtxInitializationRule(ReachabilityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(RuleContext context) {
        WorkflowDocument document = context.getDocument();
        Optional<Node> trigger = document.getNodes().stream().filter(policy::isTrigger).findFirst();
        if (trigger.isEmpty()) {
            return List.of();
        }

        for (String next : document.getConnections().primaryTargets(trigger.get().getName())) {
            Optional<Node> node = document.findNode(next);
            if (node.isEmpty()) {
                continue;
            }
            String kind = initializerKind(node.get());
            if (kind != null) {
                return List.of(
                        context.info(this, null, "ctx initialized in '" + next + "' (" + kind + ")"));
            }
        }
        return List.of();
    }

    private static String initializerKind(Node node) {
        if (NodeTypes.SET.equals(node.getSimpleType())
                && SetPreservesCtxRule.setsCtx(node.getParameters())) {
            return "Set node";
        }
        if (NodeTypes.CODE.equals(node.getSimpleType())
                && node.getParameters().getStringOrEmpty("jsCode").contains("ctx:")) {
            return "Code node";
        }
        return null;
    }
}
