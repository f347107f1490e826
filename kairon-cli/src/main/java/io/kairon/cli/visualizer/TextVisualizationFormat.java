package io.kairon.cli.visualizer;

import io.kairon.cli.ui.AnsiStyles;
import io.kairon.core.graph.GraphAnalysis;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Edge;
import io.kairon.core.workflow.node.Node;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Text visualization of a workflow's connection graph with ANSI color support.
///
/// Nodes reachable from a trigger are listed breadth-first from the triggers, indented
/// by depth. The remaining nodes follow in document order. Each node box lists its
/// outgoing connections with slot labels.
///
/// ### Markers
/// - **Green** `[trigger]`: entry points
/// - **Red** `[dead]`: nodes unreachable from any trigger
/// - **Gray** `(missing)`: connection targets that are not nodes of the document
///
/// @implNote Thread-safe. Stateless rendering.
/// @see MermaidVisualizationFormat for diagram output
@ApplicationScoped
public class TextVisualizationFormat implements VisualizationFormat {

    @Override
    public String getName() {
        return "text";
    }

    @Override
    public String render(WorkflowDocument document, GraphAnalysis analysis, AnsiStyles styles) {
        StringBuilder sb = new StringBuilder();
        sb.append(
                String.format(
                        "%s %s%n",
                        styles.bold("Workflow:"),
                        styles.accent(document.displayName("(unnamed)"))));
        sb.append(styles.separator(50)).append(System.lineSeparator());
        sb.append(
                String.format(
                        "Nodes: %d, triggers: %d, dead: %d%n%n",
                        document.getNodes().size(),
                        analysis.triggers().size(),
                        analysis.deadNodes().size()));

        Set<String> visited = new HashSet<>();
        Deque<NodeLevel> queue = new ArrayDeque<>();
        analysis.triggers().forEach(trigger -> queue.add(new NodeLevel(trigger, 0)));

        while (!queue.isEmpty()) {
            NodeLevel current = queue.removeFirst();
            if (!visited.add(current.name())) {
                continue;
            }
            Node node = document.findNode(current.name()).orElse(null);
            if (node == null) {
                continue;
            }
            renderNode(sb, document, analysis, node, "  ".repeat(current.level()), styles);
            for (String target : document.getConnections().targetsOf(current.name())) {
                queue.add(new NodeLevel(target, current.level() + 1));
            }
        }

        for (Node node : document.getNodes()) {
            if (visited.add(node.getName())) {
                renderNode(sb, document, analysis, node, "", styles);
            }
        }
        return sb.toString();
    }

    private void renderNode(
            StringBuilder sb,
            WorkflowDocument document,
            GraphAnalysis analysis,
            Node node,
            String indent,
            AnsiStyles styles) {
        String name = node.getName();
        boolean dead = analysis.isDead(name);

        StringBuilder header = new StringBuilder();
        header.append(dead ? styles.error(name) : styles.accent(name));
        header.append(' ').append(styles.gray("(" + displayType(node) + ")"));
        if (analysis.triggers().contains(name)) {
            header.append(' ').append(styles.success("[trigger]"));
        }
        if (dead) {
            header.append(' ').append(styles.error("[dead]"));
        }
        sb.append(String.format("%s%s %s%n", indent, styles.boxTop(), header));

        Map<String, List<List<Edge>>> outputs = document.getConnections().outputsOf(name);
        for (Map.Entry<String, List<List<Edge>>> byType : outputs.entrySet()) {
            List<List<Edge>> slots = byType.getValue();
            for (int slot = 0; slot < slots.size(); slot++) {
                String label = OutputLabels.of(node, byType.getKey(), slot, slots.size());
                for (Edge edge : slots.get(slot)) {
                    sb.append(
                            String.format(
                                    "%s%s  %s%s %s%n",
                                    indent,
                                    styles.boxMid(),
                                    label.isEmpty() ? "" : styles.dim(label) + " ",
                                    styles.arrow(),
                                    target(document, edge, styles)));
                }
            }
        }
        sb.append(indent).append(styles.boxBottom()).append(System.lineSeparator());
    }

    private static String target(WorkflowDocument document, Edge edge, AnsiStyles styles) {
        if (edge.node() == null) {
            return styles.gray("(missing)");
        }
        if (document.findNode(edge.node()).isEmpty()) {
            return edge.node() + " " + styles.gray("(missing)");
        }
        return styles.bold(edge.node());
    }

    private static String displayType(Node node) {
        return node.getSimpleType().isEmpty() ? "untyped" : node.getSimpleType();
    }

    private record NodeLevel(String name, int level) {}
}
