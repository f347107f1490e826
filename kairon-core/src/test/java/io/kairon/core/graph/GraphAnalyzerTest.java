package io.kairon.core.graph;

import static io.kairon.core.WorkflowFixtures.code;
import static io.kairon.core.WorkflowFixtures.document;
import static io.kairon.core.WorkflowFixtures.node;
import static io.kairon.core.WorkflowFixtures.trigger;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.core.result.Severity;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.node.Node;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

public class GraphAnalyzerTest {

    private final GraphAnalyzer analyzer = new GraphAnalyzer();

    @Test
    void shouldFindNoDeadCodeForSingleTrigger() {
        var analysis =
                analyzer.findDeadCode(document("Solo", Connections.empty(), trigger("Webhook")), "Solo");

        assertThat(analysis.deadNodes()).isEmpty();
        assertThat(analysis.triggers()).containsExactly("Webhook");
        assertThat(analysis.diagnostics()).isEmpty();
    }

    @Test
    void shouldReportUnreachableNodesOfOrderFlow() {
        var doc =
                document(
                        "Order_Flow",
                        Connections.builder().connect("Webhook", "A").build(),
                        trigger("Webhook"),
                        code("A", "return $json;"),
                        code("B", "return $json;"));

        var analysis = analyzer.findDeadCode(doc, "Order_Flow");

        assertThat(analysis.deadNodes()).containsExactly("B");
        assertThat(analysis.reachable()).containsExactlyInAnyOrder("Webhook", "A");
    }

    @Test
    void shouldFollowEveryOutputSlotAndType() {
        var doc =
                document(
                        "Branching",
                        Connections.builder()
                                .connect("Schedule", "Route")
                                .connect("Route", 2, "Third")
                                .connect("Third", "ai_tool", 0, "Tool")
                                .build(),
                        Node.builder()
                                .name("Schedule")
                                .type("n8n-nodes-base.scheduleTrigger")
                                .build(),
                        node("Route", "switch"),
                        node("Third", "set"),
                        node("Tool", "toolCode"));

        assertThat(analyzer.findDeadCode(doc, "Branching").deadNodes()).isEmpty();
    }

    @Test
    void shouldTerminateOnCycles() {
        var doc =
                document(
                        "Loop",
                        Connections.builder()
                                .connect("Webhook", "A")
                                .connect("A", "B")
                                .connect("B", "A")
                                .build(),
                        trigger("Webhook"),
                        node("A", "set"),
                        node("B", "set"));

        var analysis = analyzer.findDeadCode(doc, "Loop");

        assertThat(analysis.deadNodes()).isEmpty();
        assertThat(analysis.reachable()).hasSize(3);
    }

    @Test
    void shouldKeepDeadSetWithinNonTriggerNodes() {
        var doc =
                document(
                        "Islands",
                        Connections.builder().connect("Island", "Other").build(),
                        trigger("Webhook"),
                        Node.builder()
                                .name("Errors")
                                .type("n8n-nodes-base.errorTrigger")
                                .build(),
                        node("Island", "set"),
                        node("Other", "set"));

        var analysis = analyzer.findDeadCode(doc, "Islands");

        assertThat(analysis.deadNodes()).containsExactly("Island", "Other");
        assertThat(analysis.deadNodes()).doesNotContainAnyElementsOf(analysis.triggers());
    }

    @Test
    void shouldWarnWhenNoTriggerExists() {
        var doc =
                document(
                        "Headless",
                        Connections.builder().connect("A", "B").build(),
                        node("A", "set"),
                        node("B", "set"));

        var analysis = analyzer.findDeadCode(doc, "Headless");

        assertThat(analysis.triggers()).isEmpty();
        assertThat(analysis.deadNodes()).containsExactly("A", "B");
        assertThat(analysis.diagnostics())
                .singleElement()
                .satisfies(
                        d -> {
                            assertThat(d.severity()).isEqualTo(Severity.WARNING);
                            assertThat(d.message()).isEqualTo(GraphAnalyzer.NO_TRIGGERS);
                        });
    }

    @Test
    void shouldHonourCustomTriggerVocabulary() {
        var policy =
                new ReachabilityPolicy(
                        List.of("cron"), List.of("chainLlm"), List.of("lmChat"));
        var doc =
                document(
                        "Custom",
                        Connections.empty(),
                        Node.builder().name("Tick").type("acme.cron").build());

        assertThat(new GraphAnalyzer(policy).findDeadCode(doc, "Custom").deadNodes()).isEmpty();
    }

    // -------------------------------------------------------------------------
    // AI sub-node exception
    // -------------------------------------------------------------------------

    @Nested
    class LanguageModelExceptionTest {

        private final Node chain =
                Node.builder().name("Summarize").type("@n8n/n8n-nodes-langchain.chainLlm").build();
        private final Node model =
                Node.builder()
                        .name("OpenRouter")
                        .type("@n8n/n8n-nodes-langchain.lmChatOpenRouter")
                        .build();

        @Test
        void shouldTreatModelAsLiveWhenChainIsReachable() {
            WorkflowDocument doc =
                    document(
                            "Ai_Flow",
                            Connections.builder()
                                    .connect("Webhook", "Summarize")
                                    .connect("OpenRouter", "ai_languageModel", 0, "Summarize")
                                    .build(),
                            trigger("Webhook"),
                            chain,
                            model);

            assertThat(analyzer.findDeadCode(doc, "Ai_Flow").deadNodes()).isEmpty();
        }

        @Test
        void shouldReportModelWhenNoChainIsReachable() {
            WorkflowDocument doc =
                    document(
                            "Ai_Flow",
                            Connections.builder()
                                    .connect("OpenRouter", "ai_languageModel", 0, "Summarize")
                                    .build(),
                            trigger("Webhook"),
                            chain,
                            model);

            assertThat(analyzer.findDeadCode(doc, "Ai_Flow").deadNodes())
                    .containsExactly("OpenRouter", "Summarize");
        }

        @Test
        void shouldApplyToAgents() {
            Node agent = Node.builder().name("Agent").type("@n8n/n8n-nodes-langchain.agent").build();
            WorkflowDocument doc =
                    document(
                            "Agent_Flow",
                            Connections.builder().connect("Webhook", "Agent").build(),
                            trigger("Webhook"),
                            agent,
                            model);

            assertThat(analyzer.findDeadCode(doc, "Agent_Flow").deadNodes()).isEmpty();
        }
    }
}
