package io.kairon.core;

import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.node.Node;
import java.util.List;
import java.util.Map;

/// Node and document factories shared by core tests.
public final class WorkflowFixtures {

    private WorkflowFixtures() {}

    public static Node trigger(String name) {
        return Node.builder().name(name).type("n8n-nodes-base.webhook").typeVersion(2).build();
    }

    public static Node node(String name, String simpleType) {
        return Node.builder().name(name).type("n8n-nodes-base." + simpleType).build();
    }

    public static Node node(String name, String simpleType, Map<String, Object> parameters) {
        return Node.builder()
                .name(name)
                .type("n8n-nodes-base." + simpleType)
                .parameters(parameters)
                .build();
    }

    public static Node code(String name, String jsCode) {
        return node(name, "code", Map.of("jsCode", jsCode));
    }

    public static Node code(String name, String mode, String jsCode) {
        return node(name, "code", Map.of("mode", mode, "jsCode", jsCode));
    }

    public static WorkflowDocument document(String name, Connections connections, Node... nodes) {
        return WorkflowDocument.builder()
                .name(name)
                .nodes(List.of(nodes))
                .connections(connections)
                .build();
    }

    public static RuleContext context(WorkflowDocument document) {
        return new RuleContext(document, WorkflowRegistry.empty(), document.displayName("test"));
    }

    public static RuleContext context(WorkflowRegistry registry, Node... nodes) {
        WorkflowDocument document = document("Test_Flow", Connections.empty(), nodes);
        return new RuleContext(document, registry, "Test_Flow");
    }

    public static RuleContext context(Node... nodes) {
        return context(WorkflowRegistry.empty(), nodes);
    }
}
