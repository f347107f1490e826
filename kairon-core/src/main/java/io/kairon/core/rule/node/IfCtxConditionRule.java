package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import io.kairon.core.workflow.node.Parameters;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// If nodes must test validation results through `ctx.validation.valid`.
public class IfCtxConditionRule implements NodeRule {

    public static final String ID = "if-ctx-condition";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.IF);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Object condition : node.getParameters().getList("conditions.conditions")) {
            if (!(Parameters.asMap(condition).get("leftValue") instanceof String leftValue)) {
                continue;
            }
            if (leftValue.contains("$json.valid") && !leftValue.contains("ctx")) {
                diagnostics.add(
                        context.error(
                                this,
                                node,
                                "checks $json.valid instead of $json.ctx.validation.valid"));
            }
            if (leftValue.contains("ctx.validation.valid")) {
                diagnostics.add(context.info(this, node, "correctly checks ctx.validation.valid"));
            }
        }
        return diagnostics;
    }
}
