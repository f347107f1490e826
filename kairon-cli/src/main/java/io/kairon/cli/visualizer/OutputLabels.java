package io.kairon.cli.visualizer;

import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;

/// Display labels of output slots, shared by the visualization formats.
final class OutputLabels {

    private OutputLabels() {}

    /// Returns the label of one output slot of a node.
    ///
    /// Branching nodes name their `main` slots (`true`/`false` for IF, `output N` for
    /// Switch); other `main` outputs are unlabeled unless the node has several.
    /// Non-`main` connection types (e.g. `ai_languageModel`) are labeled by type.
    ///
    /// @param source the source node, may be null for unknown sources
    /// @param type connection type, not null
    /// @param slot output slot index
    /// @param slotCount number of slots of this type
    /// @return label, empty for the plain single main output
    static String of(Node source, String type, int slot, int slotCount) {
        if (!Connections.MAIN.equals(type)) {
            return slotCount > 1 ? type + "[" + slot + "]" : type;
        }
        String simpleType = source != null ? source.getSimpleType() : "";
        if (NodeTypes.IF.equals(simpleType) && slot < 2) {
            return slot == 0 ? "true" : "false";
        }
        if (NodeTypes.SWITCH.equals(simpleType) || slotCount > 1) {
            return "output " + slot;
        }
        return "";
    }
}
