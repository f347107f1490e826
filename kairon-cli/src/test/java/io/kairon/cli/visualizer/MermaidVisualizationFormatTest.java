package io.kairon.cli.visualizer;

import static io.kairon.cli.visualizer.TextVisualizationFormatTest.node;
import static io.kairon.cli.visualizer.TextVisualizationFormatTest.routingWorkflow;
import static org.assertj.core.api.Assertions.assertThat;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.core.graph.GraphAnalyzer;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import org.junit.jupiter.api.Test;

class MermaidVisualizationFormatTest {

    private final MermaidVisualizationFormat format = new MermaidVisualizationFormat();

    @Test
    void shouldReturnMermaidAsFormatName() {
        assertThat(format.getName()).isEqualTo("mermaid");
    }

    @Test
    void shouldWrapFlowchartInCodeBlock() {
        String result = render(routingWorkflow());

        assertThat(result).startsWith("```mermaid\nflowchart LR\n");
        assertThat(result).endsWith("```\n");
        assertThat(result).contains("subgraph workflow[\"Router\"]");
    }

    @Test
    void shouldShapeTriggersAndBranches() {
        String result = render(routingWorkflow());

        assertThat(result).contains("n0([\"Webhook\"])");
        assertThat(result).contains("n1{\"Valid?\"}");
        assertThat(result).contains("n2[\"Accept\"]");
    }

    @Test
    void shouldLabelBranchEdges() {
        String result = render(routingWorkflow());

        assertThat(result).contains("n0 --> n1");
        assertThat(result).contains("n1 -->|\"true\"| n2");
        assertThat(result).contains("n1 -->|\"false\"| n3");
    }

    @Test
    void shouldClassDeadNodes() {
        String result = render(routingWorkflow());

        assertThat(result).contains("classDef dead");
        assertThat(result).contains("class n4 dead");
    }

    @Test
    void shouldDrawSubNodeConnectionsDotted() {
        WorkflowDocument document =
                WorkflowDocument.builder()
                        .name("Agent \"Flow\"")
                        .node(node("Chat", "chatTrigger"))
                        .node(node("Agent", "agent"))
                        .node(node("Model", "lmChatOpenAi"))
                        .connections(
                                Connections.builder()
                                        .connect("Chat", "Agent")
                                        .connect("Model", "ai_languageModel", 0, "Agent")
                                        .build())
                        .build();

        String result = render(document);

        assertThat(result).contains("n2 -.->|\"ai_languageModel\"| n1");
        assertThat(result).contains("Agent #quot;Flow#quot;");
        assertThat(result).doesNotContain("classDef dead");
    }

    private String render(WorkflowDocument document) {
        return format.render(
                document, new GraphAnalyzer().findDeadCode(document, "Router"), AnsiStyles.of(false));
    }
}
