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
import java.util.regex.Pattern;

/// Discord targets must come from `ctx`; message content should not echo raw webhook
/// payloads.
///
/// `guildId` and `channelId` are resource locators (`{"mode": "id", "value": ...}`) in
/// current node versions and plain strings in older ones; both are checked.
public class DiscordCtxRule implements NodeRule {

    public static final String ID = "discord-ctx";

    private static final Pattern RAW_WEBHOOK_FIELD = Pattern.compile("\\$json\\.(body|payload|raw)");

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.DISCORD);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        Parameters parameters = node.getParameters();
        for (String field : List.of("guildId", "channelId")) {
            String value = locatorValue(parameters.get(field));
            if (value.contains("$json.") && !value.contains(".ctx.")) {
                diagnostics.add(
                        context.error(this, node, field + " uses $json.X instead of $json.ctx.*"));
            }
        }

        String content = parameters.getStringOrEmpty("content");
        if (content.contains("$json.")
                && !content.contains(".ctx.")
                && content.contains("{{")
                && RAW_WEBHOOK_FIELD.matcher(content).find()) {
            diagnostics.add(
                    context.warning(this, node, "content may use raw webhook data instead of ctx"));
        }
        return diagnostics;
    }

    private static String locatorValue(Object locator) {
        if (locator instanceof String s) {
            return s;
        }
        return Parameters.asMap(locator).get("value") instanceof String s ? s : "";
    }
}
