package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// Database access goes through the wrapper workflow, with query parameters read from
/// `ctx`.
public class PostgresCtxRule implements NodeRule {

    public static final String ID = "postgres-ctx";

    private static final Pattern FLAT_NODE_REFERENCE =
            Pattern.compile("\\$\\('([^']+)'\\)\\.item\\.json\\.(?!ctx)");

    private final String databaseWorkflow;

    public PostgresCtxRule(String databaseWorkflow) {
        this.databaseWorkflow =
                Objects.requireNonNull(databaseWorkflow, "databaseWorkflow must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.POSTGRES);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (!databaseWorkflow.equals(context.getWorkflowName())) {
            diagnostics.add(
                    context.warning(
                            this,
                            node,
                            "consider using "
                                    + databaseWorkflow
                                    + " sub-workflow instead of direct Postgres node"));
        }

        String replacement = node.getParameters().getStringOrEmpty("options.queryReplacement");
        if (FLAT_NODE_REFERENCE.matcher(replacement).find()) {
            diagnostics.add(
                    context.error(
                            this, node, "uses node reference without ctx: $('...').item.json.X"));
        } else if (replacement.contains("$json.ctx.")) {
            diagnostics.add(
                    context.info(this, node, "correctly uses ctx for query parameters"));
        }
        return diagnostics;
    }
}
