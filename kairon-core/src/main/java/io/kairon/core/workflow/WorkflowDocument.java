package io.kairon.core.workflow;

import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.Parameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable workflow document: a graph of typed nodes wired by named connections.
///
/// A document mirrors one exported workflow file. Besides the parts the linter reasons
/// about, it keeps every other top-level property verbatim and in source order, so that a
/// rewritten document differs from the original only where nodes or connections were
/// removed.
///
/// ### Structure
/// - **Nodes**: ordered, names expected to be unique within the document
/// - **Connections**: source name → type → output slots → edges
/// - **Settings**: opaque runtime settings, only `errorWorkflow` is inspected
/// - **Archived**: archived documents are skipped by analysis
///
/// ### Presence
/// A document without a `nodes` or `connections` key is not silently defaulted.
/// [#declaresNodes()] and [#declaresConnections()] report whether the keys were present
/// so that the structure rule can flag them.
///
/// @implNote Immutable and thread-safe after construction. [#withGraph(List, Connections)]
/// returns a new instance.
///
/// @see Node for the node model
/// @see Connections for the connection model
public final class WorkflowDocument {

    public static final String NAME = "name";
    public static final String ID = "id";
    public static final String NODES = "nodes";
    public static final String CONNECTIONS = "connections";
    public static final String SETTINGS = "settings";
    public static final String ARCHIVED = "isArchived";

    private final String name;
    private final String id;
    private final boolean archived;
    private final List<Node> nodes;
    private final Connections connections;
    private final Map<String, Object> settings;
    private final boolean nodesDeclared;
    private final boolean connectionsDeclared;
    private final Map<String, Object> attributes;

    private WorkflowDocument(Builder builder) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.name = attributes.get(NAME) instanceof String s ? s : null;
        this.id = attributes.get(ID) instanceof String s ? s : null;
        this.archived = Boolean.TRUE.equals(attributes.get(ARCHIVED));
        this.settings = Parameters.asMap(attributes.get(SETTINGS));
        this.nodes = List.copyOf(builder.nodes);
        this.connections = builder.connections;
        this.nodesDeclared = attributes.containsKey(NODES);
        this.connectionsDeclared = attributes.containsKey(CONNECTIONS);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns the workflow name.
    ///
    /// @return name, or null if the document declares none
    public String getName() {
        return name;
    }

    /// Returns the name used in reports.
    ///
    /// @param fallback name to use when the document has none, typically the file stem
    /// @return declared name or the fallback
    public String displayName(String fallback) {
        return name != null ? name : fallback;
    }

    /// @return runtime workflow id, or null if absent
    public String getId() {
        return id;
    }

    public boolean isArchived() {
        return archived;
    }

    /// @return nodes in document order, unmodifiable, never null
    public List<Node> getNodes() {
        return nodes;
    }

    public Connections getConnections() {
        return connections;
    }

    /// @return unmodifiable settings object, empty if absent
    public Map<String, Object> getSettings() {
        return settings;
    }

    public boolean declaresNodes() {
        return nodesDeclared;
    }

    public boolean declaresConnections() {
        return connectionsDeclared;
    }

    /// Returns the first node with the given name.
    ///
    /// @param nodeName node name, not null
    /// @return the node, or empty if absent
    public Optional<Node> findNode(String nodeName) {
        return nodes.stream().filter(n -> n.getName().equals(nodeName)).findFirst();
    }

    /// @return distinct node names in document order, never null
    public Set<String> nodeNames() {
        Set<String> names = new LinkedHashSet<>();
        nodes.forEach(n -> names.add(n.getName()));
        return names;
    }

    /// Returns every top-level property in source order.
    ///
    /// The `nodes` and `connections` values in this map are the ones originally read;
    /// writers must use [#getNodes()] and [#getConnections()] for those keys.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /// Returns a copy with replaced nodes and connections and every other property kept.
    ///
    /// @param newNodes replacement nodes, not null
    /// @param newConnections replacement connections, not null
    /// @return new document, never null
    public WorkflowDocument withGraph(List<Node> newNodes, Connections newConnections) {
        return builder().attributes(attributes).nodes(newNodes).connections(newConnections).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WorkflowDocument that)) return false;
        return nodes.equals(that.nodes)
                && connections.equals(that.connections)
                && withoutGraph(attributes).equals(withoutGraph(that.attributes));
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, connections, withoutGraph(attributes));
    }

    @Override
    public String toString() {
        return "WorkflowDocument{name='" + name + "', nodes=" + nodes.size() + "}";
    }

    private static Map<String, Object> withoutGraph(Map<String, Object> attributes) {
        Map<String, Object> rest = new LinkedHashMap<>(attributes);
        rest.keySet().removeAll(Set.of(NODES, CONNECTIONS));
        return rest;
    }

    /// Builder for workflow documents.
    ///
    /// Programmatic documents always declare `nodes` and `connections` unless
    /// [#without(String)] removes them. Documents read from JSON pass their raw top-level
    /// object to [#attributes(Map)], which then decides which keys are present.
    public static final class Builder {
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Set<String> omitted = new LinkedHashSet<>();
        private final List<Node> nodes = new ArrayList<>();
        private Connections connections = Connections.empty();
        private boolean raw;

        private Builder() {}

        /// Replaces all top-level properties with a raw JSON object.
        public Builder attributes(Map<String, Object> rawAttributes) {
            this.attributes.clear();
            this.attributes.putAll(rawAttributes);
            this.raw = true;
            return this;
        }

        public Builder name(String name) {
            this.attributes.put(NAME, name);
            return this;
        }

        public Builder id(String id) {
            this.attributes.put(ID, id);
            return this;
        }

        public Builder archived(boolean archived) {
            this.attributes.put(ARCHIVED, archived);
            return this;
        }

        public Builder settings(Map<String, Object> settings) {
            this.attributes.put(SETTINGS, settings);
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.attributes.put(key, value);
            return this;
        }

        /// Drops a top-level property, e.g. to model a document without `connections`.
        public Builder without(String key) {
            this.omitted.add(key);
            return this;
        }

        public Builder node(Node node) {
            this.nodes.add(Objects.requireNonNull(node, "node must not be null"));
            return this;
        }

        public Builder nodes(List<Node> nodes) {
            this.nodes.clear();
            this.nodes.addAll(nodes);
            return this;
        }

        public Builder connections(Connections connections) {
            this.connections = Objects.requireNonNull(connections, "connections required");
            return this;
        }

        public WorkflowDocument build() {
            if (!raw) {
                attributes.putIfAbsent(NODES, List.of());
                attributes.putIfAbsent(CONNECTIONS, Map.of());
            }
            attributes.keySet().removeAll(omitted);
            return new WorkflowDocument(this);
        }
    }
}
