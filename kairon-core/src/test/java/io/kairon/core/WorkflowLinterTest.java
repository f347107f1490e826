package io.kairon.core;

import static io.kairon.core.WorkflowFixtures.code;
import static io.kairon.core.WorkflowFixtures.document;
import static io.kairon.core.WorkflowFixtures.node;
import static io.kairon.core.WorkflowFixtures.trigger;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

import io.kairon.core.fix.DeadCodeFixer;
import io.kairon.core.graph.GraphAnalyzer;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.ResultAggregator;
import io.kairon.core.result.ValidationStatus;
import io.kairon.core.rule.RuleEngine;
import io.kairon.core.rule.node.SubWorkflowReferenceRule;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
public class WorkflowLinterTest {

    @Mock private RuleEngine ruleEngine;

    private final WorkflowLinter linter = new WorkflowLinter(LinterConfig.defaults());

    @Test
    void shouldFailOrderFlowWithDeadNode() {
        var orderFlow =
                document(
                        "Order_Flow",
                        Connections.builder().connect("Webhook", "A").build(),
                        trigger("Webhook"),
                        code("A", "return $json;"),
                        code("B", "return $json;"));

        var result = linter.lint(orderFlow, WorkflowRegistry.empty(), "order_flow.json");

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.FAIL);
        assertThat(result.getDeadNodes()).containsExactly("B");
        assertThat(result.getErrors())
                .singleElement()
                .extracting(Diagnostic::message)
                .asString()
                .contains("B");
    }

    @Test
    void shouldPassCleanWorkflowWithSuccessNote() {
        var clean =
                document(
                        "Clean",
                        Connections.builder().connect("Webhook", "Reply").build(),
                        trigger("Webhook"),
                        node("Reply", "respondToWebhook"));

        var result = linter.lint(clean, WorkflowRegistry.empty(), "clean.json");

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.PASS);
        assertThat(result.getInfos())
                .extracting(Diagnostic::message)
                .contains("All 2 nodes validated successfully");
    }

    @Test
    void shouldSkipArchivedWorkflowWithoutEvaluatingRules() {
        var archivedLinter =
                new WorkflowLinter(
                        new GraphAnalyzer(), ruleEngine, new ResultAggregator(), new DeadCodeFixer());
        var archived =
                WorkflowDocument.builder()
                        .name("Old_Flow")
                        .archived(true)
                        .node(node("Orphan", "set"))
                        .build();

        var result = archivedLinter.lint(archived, WorkflowRegistry.empty(), "old_flow.json");

        assertThat(result.getStatus()).isEqualTo(ValidationStatus.PASS);
        assertThat(result.getInfos())
                .singleElement()
                .extracting(Diagnostic::message)
                .isEqualTo(WorkflowLinter.ARCHIVED_MESSAGE);
        verifyNoInteractions(ruleEngine);
    }

    @Test
    void shouldResolveSubWorkflowOnceRegistryKnowsIt() {
        var caller =
                document(
                        "Caller",
                        Connections.builder().connect("Webhook", "Call DB").build(),
                        trigger("Webhook"),
                        node(
                                "Call DB",
                                "executeWorkflow",
                                Map.of(
                                        "workflowId",
                                        Map.of("mode", "list", "value", "5", "cachedResultName", "Query_DB"))));

        var before = linter.lint(caller, WorkflowRegistry.ofNames("Caller"), "caller.json");
        var after = linter.lint(caller, WorkflowRegistry.ofNames("Caller", "Query_DB"), "caller.json");

        assertThat(before.getErrors())
                .singleElement()
                .extracting(Diagnostic::ruleId)
                .isEqualTo(SubWorkflowReferenceRule.ID);
        assertThat(after.getErrors()).isEmpty();
    }

    @Test
    void shouldNameUnnamedDocumentAfterFileStem() {
        var unnamed =
                WorkflowDocument.builder()
                        .node(trigger("Webhook"))
                        .connections(Connections.empty())
                        .build();

        var result = linter.lint(unnamed, WorkflowRegistry.empty(), "flows/route_message.json");

        assertThat(result.getWorkflowName()).isEqualTo("route_message");
        assertThat(result.getSource()).isEqualTo("flows/route_message.json");
    }

    @Test
    void shouldReportMissingConnectionsAsStructuralError() {
        var broken =
                WorkflowDocument.builder()
                        .name("Broken")
                        .node(trigger("Webhook"))
                        .without(WorkflowDocument.CONNECTIONS)
                        .build();

        var result = linter.lint(broken, WorkflowRegistry.empty(), "broken.json");

        assertThat(result.getErrors())
                .extracting(Diagnostic::message)
                .containsExactly("Missing required top-level key 'connections'");
    }

    @Test
    void shouldStripPathAndExtensionFromSource() {
        assertThat(WorkflowLinter.stem("n8n-workflows/Route_Message.json")).isEqualTo("Route_Message");
        assertThat(WorkflowLinter.stem("notes.txt")).isEqualTo("notes.txt");
    }
}
