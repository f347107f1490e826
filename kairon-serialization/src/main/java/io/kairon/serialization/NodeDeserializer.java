package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.kairon.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;

/// Deserializes a node object, keeping every property in source order.
///
/// Only the `name` is required here; missing `type`, `typeVersion`, `parameters` or
/// `position` are reported later by the lint rules, not by the parser.
///
/// @implNote Package-private. Registered by {@link KaironJacksonModule}.
/// @see NodeSerializer for the inverse operation
class NodeDeserializer extends StdDeserializer<Node> {

    @Serial private static final long serialVersionUID = -6337194426521052718L;

    static final TypeReference<LinkedHashMap<String, Object>> OBJECT_MAP =
            new TypeReference<>() {};

    NodeDeserializer() {
        super(Node.class);
    }

    /// @throws IOException if the value is not an object or has no string `name`
    @Override
    public Node deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (root == null || !root.isObject()) {
            throw new InvalidDocumentException(p, "Node must be a JSON object");
        }
        JsonNode name = root.get(Node.NAME);
        if (name == null || !name.isTextual()) {
            throw new InvalidDocumentException(p, "Node has no string 'name' property");
        }
        return Node.fromAttributes(mapper.convertValue(root, OBJECT_MAP));
    }
}
