package io.kairon.core.workflow.connection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Immutable connection map of a workflow document.
///
/// Shape: source node name → connection type → ordered output slots → ordered edges.
/// Slot 0 of `main` is the primary path; branching nodes (`if`, `switch`) route to
/// further slots. AI sub-nodes connect through dedicated types such as
/// `ai_languageModel`.
///
/// ### Pruning
/// [#without(Set)] drops the source keys of removed nodes and every edge pointing at them.
/// Slots that become empty are kept so that surviving slot indices do not shift.
///
/// ### Null slots
/// n8n exports unconnected outputs of branching nodes as `null`. Such a slot reads as empty
/// and [#toMap()] writes it back as `null` while it has no edges.
///
/// @implNote Immutable and thread-safe after construction. Nested lists are unmodifiable.
public final class Connections {

    public static final String MAIN = "main";

    private static final Connections EMPTY = new Connections(Map.of(), Set.of());

    private final Map<String, Map<String, List<List<Edge>>>> outputs;
    private final Set<SlotRef> nullSlots;

    private Connections(
            Map<String, Map<String, List<List<Edge>>>> outputs, Set<SlotRef> nullSlots) {
        this.outputs = outputs;
        this.nullSlots = nullSlots;
    }

    public static Connections empty() {
        return EMPTY;
    }

    /// Creates connections from an already structured map.
    ///
    /// @param outputs source → type → slots → edges, not null; a slot may be null
    /// @return immutable deep copy, never null
    public static Connections of(Map<String, Map<String, List<List<Edge>>>> outputs) {
        Objects.requireNonNull(outputs, "outputs must not be null");
        Map<String, Map<String, List<List<Edge>>>> copy = new LinkedHashMap<>();
        Set<SlotRef> nullSlots = new LinkedHashSet<>();
        outputs.forEach((source, byType) -> copy.put(source, copyTypes(source, byType, nullSlots)));
        return new Connections(
                Collections.unmodifiableMap(copy), Collections.unmodifiableSet(nullSlots));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns all source node names in declaration order.
    ///
    /// @return unmodifiable set, never null
    public Set<String> sources() {
        return outputs.keySet();
    }

    public boolean isEmpty() {
        return outputs.isEmpty();
    }

    /// Returns the outputs of a source grouped by connection type.
    ///
    /// @param source source node name, not null
    /// @return unmodifiable map, empty if the node has no outgoing connections
    public Map<String, List<List<Edge>>> outputsOf(String source) {
        return outputs.getOrDefault(source, Map.of());
    }

    /// Returns the `main` output slots of a source.
    ///
    /// @param source source node name, not null
    /// @return slots in order, empty if none
    public List<List<Edge>> mainOutputs(String source) {
        return outputsOf(source).getOrDefault(MAIN, List.of());
    }

    /// Returns the targets of the primary path, `main` slot 0.
    ///
    /// @param source source node name, not null
    /// @return target names in order, never null
    public List<String> primaryTargets(String source) {
        List<List<Edge>> slots = mainOutputs(source);
        if (slots.isEmpty()) {
            return List.of();
        }
        return names(slots.get(0));
    }

    /// Returns the targets of every `main` slot of a source.
    ///
    /// @param source source node name, not null
    /// @return target names in slot order, never null
    public List<String> mainTargets(String source) {
        List<String> targets = new ArrayList<>();
        mainOutputs(source).forEach(slot -> targets.addAll(names(slot)));
        return targets;
    }

    /// Flattens every connection type and output slot of a source.
    ///
    /// @param source source node name, not null
    /// @return target names in declaration order, edges without a node skipped
    public List<String> targetsOf(String source) {
        List<String> targets = new ArrayList<>();
        for (List<List<Edge>> slots : outputsOf(source).values()) {
            slots.forEach(slot -> targets.addAll(names(slot)));
        }
        return targets;
    }

    /// Lists every edge together with its source, type and slot.
    ///
    /// @return connections in declaration order, never null
    public List<Connection> all() {
        List<Connection> all = new ArrayList<>();
        outputs.forEach(
                (source, byType) ->
                        byType.forEach(
                                (type, slots) -> {
                                    for (int slot = 0; slot < slots.size(); slot++) {
                                        for (Edge edge : slots.get(slot)) {
                                            all.add(new Connection(source, type, slot, edge));
                                        }
                                    }
                                }));
        return all;
    }

    /// Returns a copy without any connection from or to the given nodes.
    ///
    /// @param removed node names to prune, not null
    /// @return pruned connections, this instance if nothing changes
    public Connections without(Set<String> removed) {
        Objects.requireNonNull(removed, "removed must not be null");
        if (removed.isEmpty()) {
            return this;
        }
        Map<String, Map<String, List<List<Edge>>>> pruned = new LinkedHashMap<>();
        outputs.forEach(
                (source, byType) -> {
                    if (removed.contains(source)) {
                        return;
                    }
                    Map<String, List<List<Edge>>> types = new LinkedHashMap<>();
                    byType.forEach(
                            (type, slots) -> {
                                List<List<Edge>> kept = new ArrayList<>();
                                for (List<Edge> slot : slots) {
                                    kept.add(
                                            slot.stream()
                                                    .filter(e -> !removed.contains(e.node()))
                                                    .toList());
                                }
                                types.put(type, kept);
                            });
                    pruned.put(source, types);
                });
        Set<SlotRef> keptNullSlots = new LinkedHashSet<>();
        for (SlotRef slot : nullSlots) {
            if (!removed.contains(slot.source())) {
                keptNullSlots.add(slot);
            }
        }
        Connections result =
                new Connections(of(pruned).outputs, Collections.unmodifiableSet(keptNullSlots));
        return result.equals(this) ? this : result;
    }

    /// Returns the JSON object form of these connections.
    ///
    /// @return nested mutable maps and lists, never null; null slots stay null
    public Map<String, Object> toMap() {
        Map<String, Object> json = new LinkedHashMap<>();
        outputs.forEach(
                (source, byType) -> {
                    Map<String, Object> types = new LinkedHashMap<>();
                    byType.forEach(
                            (type, slots) -> {
                                List<Object> slotList = new ArrayList<>();
                                for (int i = 0; i < slots.size(); i++) {
                                    List<Edge> slot = slots.get(i);
                                    boolean wasNull =
                                            slot.isEmpty()
                                                    && nullSlots.contains(new SlotRef(source, type, i));
                                    slotList.add(
                                            wasNull ? null : slot.stream().map(Edge::toMap).toList());
                                }
                                types.put(type, slotList);
                            });
                    json.put(source, types);
                });
        return json;
    }

    public Map<String, Map<String, List<List<Edge>>>> asMap() {
        return outputs;
    }

    private static List<String> names(List<Edge> slot) {
        List<String> names = new ArrayList<>(slot.size());
        for (Edge edge : slot) {
            if (edge.node() != null) {
                names.add(edge.node());
            }
        }
        return names;
    }

    private static Map<String, List<List<Edge>>> copyTypes(
            String source, Map<String, List<List<Edge>>> byType, Set<SlotRef> nullSlots) {
        Map<String, List<List<Edge>>> types = new LinkedHashMap<>();
        byType.forEach(
                (type, slots) -> {
                    List<List<Edge>> copied = new ArrayList<>();
                    for (List<Edge> slot : slots) {
                        if (slot == null) {
                            nullSlots.add(new SlotRef(source, type, copied.size()));
                            copied.add(List.of());
                        } else {
                            copied.add(List.copyOf(slot));
                        }
                    }
                    types.put(type, Collections.unmodifiableList(copied));
                });
        return Collections.unmodifiableMap(types);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Connections that)) return false;
        return outputs.equals(that.outputs) && nullSlots.equals(that.nullSlots);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outputs, nullSlots);
    }

    @Override
    public String toString() {
        return "Connections" + outputs;
    }

    private record SlotRef(String source, String type, int slot) {}

    /// Fluent builder for connection maps, mainly used by tests and tooling.
    public static final class Builder {
        private final Map<String, Map<String, List<List<Edge>>>> outputs = new LinkedHashMap<>();

        private Builder() {}

        /// Connects the primary output of a source to a target.
        public Builder connect(String source, String target) {
            return connect(source, MAIN, 0, target);
        }

        /// Connects a `main` output slot of a source to a target.
        public Builder connect(String source, int slot, String target) {
            return connect(source, MAIN, slot, target);
        }

        /// Connects an output slot of the given type; missing lower slots are created empty.
        public Builder connect(String source, String type, int slot, String target) {
            List<List<Edge>> slots =
                    outputs.computeIfAbsent(source, k -> new LinkedHashMap<>())
                            .computeIfAbsent(type, k -> new ArrayList<>());
            while (slots.size() <= slot) {
                slots.add(new ArrayList<>());
            }
            slots.get(slot).add(new Edge(target, type, 0));
            return this;
        }

        public Connections build() {
            return of(outputs);
        }
    }
}
