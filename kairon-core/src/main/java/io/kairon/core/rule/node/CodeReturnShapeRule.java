package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// In per-item mode a code node must return one object, not an array of items.
///
/// Returning `[...$input.all()]`-style spreads is how pass-through nodes forward items and
/// is not flagged.
public class CodeReturnShapeRule implements NodeRule {

    public static final String ID = "code-return-shape";

    private static final Pattern RETURNS_ARRAY_OF_OBJECTS = Pattern.compile("return\\s+\\[\\s*\\{");
    private static final Pattern SPREADS_INPUT =
            Pattern.compile("return\\s+\\[\\s*\\.\\.\\.|\\.\\.\\.\\$input");

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
        String code = CodeModes.jsCode(node);
        if (code.isBlank() || !CodeModes.isPerItem(node)) {
            return List.of();
        }
        if (RETURNS_ARRAY_OF_OBJECTS.matcher(code).find()
                && !code.contains("return [{json:")
                && !SPREADS_INPUT.matcher(code).find()) {
            return List.of(
                    context.warning(
                            this,
                            node,
                            "Code in runOnceForEachItem mode returns array"
                                    + " - should return single object"));
        }
        return List.of();
    }
}
