package io.kairon.cli.visualizer;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.connection.Edge;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Mermaid flowchart visualization of a workflow's connection graph.
///
/// Generates Mermaid syntax wrapped in a Markdown code block. Output can be rendered in
/// GitHub/GitLab Markdown, documentation tools, or at [mermaid.live](https://mermaid.live).
///
/// ### Node Shape Mapping
/// - **Trigger**: stadium
/// - **IF / Switch**: rhombus
/// - **Other nodes**: rectangle
///
/// Dead nodes get the `dead` class (red, dashed border).
///
/// ### Edge Styles
/// - **Solid arrow** (`-->`) - `main` connections, labeled by slot where meaningful
/// - **Dotted arrow** (`-.->`) - other connection types (AI sub-nodes), labeled by type
///
/// Node ids are positional (`n0`, `n1`, ...) since node names may contain any character.
/// Edges to names that are not nodes of the document are omitted.
///
/// @implNote Thread-safe. Stateless rendering.
/// @see TextVisualizationFormat for terminal output
@ApplicationScoped
public class MermaidVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(WorkflowDocument document, GraphAnalysis analysis, AnsiStyles styles) {
        Map<String, String> ids = new LinkedHashMap<>();
        for (Node node : document.getNodes()) {
            ids.putIfAbsent(node.getName(), "n" + ids.size());
        }

        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart LR\n");
        sb.append("  subgraph workflow[\"")
                .append(escape(document.displayName("workflow")))
                .append("\"]\n");
        Set<String> rendered = new HashSet<>();
        for (Node node : document.getNodes()) {
            if (rendered.add(node.getName())) {
                sb.append("    ").append(shape(ids.get(node.getName()), node, analysis)).append('\n');
            }
        }
        sb.append("  end\n\n");

        Connections connections = document.getConnections();
        for (String source : connections.sources()) {
            String sourceId = ids.get(source);
            if (sourceId == null) {
                continue;
            }
            Node sourceNode = document.findNode(source).orElse(null);
            for (Map.Entry<String, List<List<Edge>>> byType :
                    connections.outputsOf(source).entrySet()) {
                renderEdges(sb, ids, sourceId, sourceNode, byType.getKey(), byType.getValue());
            }
        }

        if (!analysis.deadNodes().isEmpty()) {
            sb.append("\n  classDef dead fill:#fde2e2,stroke:#c0392b,stroke-dasharray: 5 5\n");
            for (String dead : analysis.deadNodes()) {
                if (ids.containsKey(dead)) {
                    sb.append("  class ").append(ids.get(dead)).append(" dead\n");
                }
            }
        }

        sb.append("```\n");
        return sb.toString();
    }

    private static void renderEdges(
            StringBuilder sb,
            Map<String, String> ids,
            String sourceId,
            Node sourceNode,
            String type,
            List<List<Edge>> slots) {
        String arrow = Connections.MAIN.equals(type) ? "-->" : "-.->";
        for (int slot = 0; slot < slots.size(); slot++) {
            String label = OutputLabels.of(sourceNode, type, slot, slots.size());
            for (Edge edge : slots.get(slot)) {
                String targetId = edge.node() != null ? ids.get(edge.node()) : null;
                if (targetId == null) {
                    continue;
                }
                sb.append("  ").append(sourceId).append(' ').append(arrow);
                if (!label.isEmpty()) {
                    sb.append("|\"").append(escape(label)).append("\"|");
                }
                sb.append(' ').append(targetId).append('\n');
            }
        }
    }

    private static String shape(String id, Node node, GraphAnalysis analysis) {
        String label = "\"" + escape(node.getName()) + "\"";
        if (analysis.triggers().contains(node.getName())) {
            return id + "([" + label + "])";
        }
        String simpleType = node.getSimpleType();
        if (NodeTypes.IF.equals(simpleType) || NodeTypes.SWITCH.equals(simpleType)) {
            return id + "{" + label + "}";
        }
        return id + "[" + label + "]";
    }

    private static String escape(String text) {
        return text.replace("\"", "#quot;");
    }
}
