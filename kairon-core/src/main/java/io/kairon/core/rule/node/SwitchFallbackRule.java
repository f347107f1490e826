package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Checks the fallback output of switch nodes.
///
/// Without a fallback, items matching no case are silently dropped. From version 3 on,
/// the runtime only accepts the strings `extra` and `none` for `options.fallbackOutput`.
public class SwitchFallbackRule implements NodeRule {

    public static final String ID = "switch-fallback";

    static final Set<String> ACCEPTED_FALLBACKS = Set.of("extra", "none");
    private static final double STRICT_FALLBACK_VERSION = 3;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.SWITCH);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        Map<String, Object> options = node.getParameters().getMap("options");
        if (!options.containsKey("fallbackOutput")) {
            return List.of(
                    context.warning(
                            this,
                            node,
                            "Switch node has no fallback output"
                                    + " - unmatched cases will produce no output"));
        }

        Object fallback = options.get("fallbackOutput");
        if (node.getTypeVersion() < STRICT_FALLBACK_VERSION || fallback == null) {
            return List.of();
        }
        if (!(fallback instanceof String value)) {
            return List.of(
                    context.error(
                            this,
                            node,
                            "Switch node fallbackOutput must be string ('extra' or 'none'), got: "
                                    + jsonTypeOf(fallback)));
        }
        if (!ACCEPTED_FALLBACKS.contains(value)) {
            return List.of(
                    context.error(
                            this, node, "Switch node fallbackOutput invalid value: '" + value + "'"));
        }
        return List.of();
    }

    private static String jsonTypeOf(Object value) {
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Map) return "object";
        if (value instanceof List) return "array";
        return value.getClass().getSimpleName();
    }
}
