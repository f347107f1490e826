package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/// Checks that code initialising `ctx.event` sets the tracing fields.
///
/// `event_id` is required; `trace_chain` is recommended. Fields are searched in the code
/// following the first `event:` key, since nested literals defeat precise matching.
public class CtxEventFieldsRule implements NodeRule {

    public static final String ID = "ctx-event-fields";

    private static final Pattern EVENT_ID = Pattern.compile("\\bevent_id\\s*:");
    private static final Pattern TRACE_CHAIN = Pattern.compile("\\btrace_chain\\s*:");

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
        if (!code.contains("ctx:") || !code.contains("event:")) {
            return List.of();
        }
        String eventSection = code.substring(code.indexOf("event:"));
        if (!EVENT_ID.matcher(eventSection).find()) {
            return List.of(
                    context.error(
                            this, node, "ctx.event initialization missing critical fields: event_id"));
        }
        if (!TRACE_CHAIN.matcher(eventSection).find()) {
            return List.of(
                    context.warning(
                            this,
                            node,
                            "ctx.event initialization missing recommended fields: trace_chain"));
        }
        return List.of(context.info(this, node, "ctx.event has required fields"));
    }
}
