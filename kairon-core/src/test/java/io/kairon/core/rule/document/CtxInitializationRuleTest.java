package io.kairon.core.rule.document;

import static io.kairon.core.WorkflowFixtures.code;
import static io.kairon.core.WorkflowFixtures.context;
import static io.kairon.core.WorkflowFixtures.document;
import static io.kairon.core.WorkflowFixtures.node;
import static io.kairon.core.WorkflowFixtures.trigger;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.graph.ReachabilityPolicy;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.workflow.connection.Connections;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class CtxInitializationRuleTest {

    private final CtxInitializationRule rule =
            new CtxInitializationRule(ReachabilityPolicy.defaults());

    @Test
    void shouldNoteSetNodeInitializer() {
        var init =
                node(
                        "Init Context",
                        "set",
                        Map.of(
                                "assignments",
                                Map.of("assignments", List.of(Map.of("name", "ctx.event", "value", "={{ $json }}")))));
        var doc =
                document(
                        "Flow",
                        Connections.builder().connect("Webhook", "Init Context").build(),
                        trigger("Webhook"),
                        init);

        assertThat(rule.check(context(doc)))
                .singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("ctx initialized in 'Init Context' (Set node)");
    }

    @Test
    void shouldNoteCodeNodeInitializer() {
        var doc =
                document(
                        "Flow",
                        Connections.builder().connect("Webhook", "Prepare Event").build(),
                        trigger("Webhook"),
                        code("Prepare Event", "return { ctx: { event: { event_id: $json.id } } };"));

        assertThat(rule.check(context(doc)))
                .singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo("ctx initialized in 'Prepare Event' (Code node)");
    }

    @Test
    void shouldStaySilentWithoutInitializer() {
        var doc =
                document(
                        "Flow",
                        Connections.builder().connect("Webhook", "Format").build(),
                        trigger("Webhook"),
                        code("Format", "return $json;"));

        assertThat(rule.check(context(doc))).isEmpty();
    }
}
