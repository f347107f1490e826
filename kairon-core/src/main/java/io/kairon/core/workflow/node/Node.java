package io.kairon.core.workflow.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// A single node of a workflow document.
///
/// Besides the typed fields rules work with, a node keeps its complete raw JSON object so
/// that a rewritten document reproduces surviving nodes exactly as they were read,
/// including properties this library never inspects (`id`, `credentials`,
/// `webhookId`, ...).
///
/// ### Required properties
/// The runtime requires `parameters`, `type`, `typeVersion` and `position`. A node is
/// still constructed when they are missing; [#has(String)] lets the shape rule report them.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see Parameters for typed parameter access
/// @see NodeTypes for simplified type names
public final class Node {

    public static final String NAME = "name";
    public static final String TYPE = "type";
    public static final String TYPE_VERSION = "typeVersion";
    public static final String PARAMETERS = "parameters";
    public static final String POSITION = "position";

    private final String name;
    private final String type;
    private final String simpleType;
    private final double typeVersion;
    private final Parameters parameters;
    private final Map<String, Object> attributes;

    private Node(String name, Map<String, Object> attributes) {
        this.name = Objects.requireNonNull(name, "Node name required");
        this.attributes = Collections.unmodifiableMap(attributes);
        this.type = attributes.get(TYPE) instanceof String s ? s : null;
        this.simpleType = NodeTypes.simpleName(type);
        this.typeVersion =
                attributes.get(TYPE_VERSION) instanceof Number n ? n.doubleValue() : 1.0;
        this.parameters = Parameters.of(Parameters.asMap(attributes.get(PARAMETERS)));
    }

    /// Creates a node from its raw JSON object.
    ///
    /// @param attributes raw node object, must contain a string `name`
    /// @return node, never null
    /// @throws IllegalArgumentException if the name is missing or not a string
    public static Node fromAttributes(Map<String, Object> attributes) {
        Objects.requireNonNull(attributes, "attributes must not be null");
        if (!(attributes.get(NAME) instanceof String name)) {
            throw new IllegalArgumentException("Node has no string 'name' property");
        }
        return new Node(name, new LinkedHashMap<>(attributes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    /// Returns the namespaced node type.
    ///
    /// @return type, or null if the node declares none
    public String getType() {
        return type;
    }

    /// Returns the last segment of the node type, used for rule dispatch.
    ///
    /// @return simplified type, empty if the node declares no type
    public String getSimpleType() {
        return simpleType;
    }

    /// Returns the numeric type version.
    ///
    /// @return declared version, or 1 if absent
    public double getTypeVersion() {
        return typeVersion;
    }

    public Parameters getParameters() {
        return parameters;
    }

    /// Checks whether the raw node object declares a property.
    ///
    /// @param property top-level property name, not null
    /// @return true if present, even with a JSON null value
    public boolean has(String property) {
        return attributes.containsKey(property);
    }

    /// Returns the raw JSON object of this node in source order.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Node node)) return false;
        return attributes.equals(node.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Node{name='" + name + "', type='" + type + "'}";
    }

    /// Builder producing nodes in the property order the runtime exports them.
    ///
    /// `parameters`, `typeVersion` and `position` default to an empty object, `1` and
    /// `[0, 0]`; [#without(String)] drops a property to model incomplete nodes.
    public static final class Builder {
        private String name;
        private String type;
        private Number typeVersion = 1;
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private List<Object> position = List.of(0, 0);
        private final Map<String, Object> extra = new LinkedHashMap<>();
        private final List<String> omitted = new ArrayList<>();

        private Builder() {}

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder typeVersion(Number typeVersion) {
            this.typeVersion = typeVersion;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = new LinkedHashMap<>(parameters);
            return this;
        }

        public Builder parameter(String key, Object value) {
            this.parameters.put(key, value);
            return this;
        }

        public Builder position(int x, int y) {
            this.position = List.of(x, y);
            return this;
        }

        public Builder attribute(String key, Object value) {
            this.extra.put(key, value);
            return this;
        }

        public Builder without(String property) {
            this.omitted.add(property);
            return this;
        }

        public Node build() {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put(PARAMETERS, parameters);
            attributes.put(NAME, name);
            attributes.put(TYPE, type);
            attributes.put(TYPE_VERSION, typeVersion);
            attributes.put(POSITION, position);
            attributes.putAll(extra);
            omitted.forEach(attributes::remove);
            return new Node(name, attributes);
        }
    }
}
