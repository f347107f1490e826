package io.kairon.core.workflow.connection;

/// A single edge together with its origin: source node, connection type and output slot.
///
/// @param source source node name, not null
/// @param type connection type, e.g. `main` or `ai_languageModel`
/// @param slot zero-based output slot of the source
/// @param edge the target entry
public record Connection(String source, String type, int slot, Edge edge) {

    public String target() {
        return edge.node();
    }
}
