package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// `$input.first()`, `$input.last()` and `$input.all()` are not available per item.
///
/// Nodes without an explicit mode are checked too: older node versions defaulted to
/// per-item execution.
public class CodeInputAccessRule implements NodeRule {

    public static final String ID = "code-input-access";

    private static final Pattern ALL_ITEMS_ACCESS = Pattern.compile("\\$input\\.(first|last|all)\\b");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.CODE);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        String mode = node.getParameters().getString("mode");
        if (mode != null && !CodeModes.PER_ITEM.equals(mode)) {
            return List.of();
        }
        if (!ALL_ITEMS_ACCESS.matcher(CodeModes.jsCode(node)).find()) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        node,
                        "uses $input.first()/last()/all() which fails in runOnceForEachItem mode"
                                + " - set mode to runOnceForAllItems or use $input.item"));
    }
}
