package io.kairon.core.rule.node;

import static io.kairon.core.WorkflowFixtures.context;
import static io.kairon.core.WorkflowFixtures.document;
import static io.kairon.core.WorkflowFixtures.node;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.Severity;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.node.Node;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class PostgresCtxRuleTest {

    private final PostgresCtxRule rule = new PostgresCtxRule("Query_DB");

    @Test
    void shouldSuggestDatabaseWrapperOutsideIt() {
        var node = postgres("={{ $json.ctx.db.user_id }}");

        assertThat(rule.check(node, context(node)))
                .extracting(Diagnostic::severity)
                .containsExactly(Severity.WARNING, Severity.INFO);
    }

    @Test
    void shouldAllowDirectUseInsideWrapper() {
        var node = postgres("={{ $json.ctx.db.user_id }}");
        var wrapper =
                new RuleContext(
                        document("Query_DB", Connections.empty(), node),
                        WorkflowRegistry.empty(),
                        "Query_DB");

        assertThat(rule.check(node, wrapper))
                .extracting(Diagnostic::severity)
                .containsExactly(Severity.INFO);
    }

    @Test
    void shouldRejectFlatNodeReferenceInQueryReplacement() {
        var node = postgres("={{ $('Prepare Event').item.json.user_id }}");

        assertThat(rule.check(node, context(node)))
                .filteredOn(d -> d.severity() == Severity.ERROR)
                .singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("'Store Event': uses node reference without ctx: $('...').item.json.X");
    }

    private static Node postgres(String queryReplacement) {
        return node(
                "Store Event",
                "postgres",
                Map.of(
                        "operation", "executeQuery",
                        "query", "INSERT INTO events (user_id) VALUES ($1)",
                        "options", Map.of("queryReplacement", queryReplacement)));
    }
}
