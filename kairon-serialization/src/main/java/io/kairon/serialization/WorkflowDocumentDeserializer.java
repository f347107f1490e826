package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.connection.Connections;
import io.kairon.core.workflow.connection.Edge;
import io.kairon.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Deserializes an exported workflow file into a `WorkflowDocument`.
///
/// ### Shape checks
/// The parser rejects only what makes the document uninterpretable:
/// - a root that is not an object
/// - `nodes` that is not an array, or a node without a string `name`
/// - `connections` that is not an object, or whose nesting is not
///   source → type → slots → edges
///
/// Absent `nodes` or `connections` keys are not errors here; the document records their
/// absence and the structure rule reports it. A `null` output slot is kept as a null slot of
/// the [Connections] model.
///
/// @implNote Package-private. Registered by {@link KaironJacksonModule}.
/// @see WorkflowDocumentSerializer for the inverse operation
class WorkflowDocumentDeserializer extends StdDeserializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = 8061587307448816452L;

    WorkflowDocumentDeserializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public WorkflowDocument deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        if (root == null || !root.isObject()) {
            throw new InvalidDocumentException(p, "Workflow root must be a JSON object");
        }

        WorkflowDocument.Builder builder =
                WorkflowDocument.builder()
                        .attributes(mapper.convertValue(root, NodeDeserializer.OBJECT_MAP));

        JsonNode nodes = root.get(WorkflowDocument.NODES);
        if (nodes != null) {
            if (!nodes.isArray()) {
                throw new InvalidDocumentException(p, "'nodes' must be an array");
            }
            List<Node> parsed = new ArrayList<>();
            for (JsonNode node : nodes) {
                if (!node.isObject()) {
                    throw new InvalidDocumentException(p, "Node must be a JSON object");
                }
                parsed.add(mapper.treeToValue(node, Node.class));
            }
            builder.nodes(parsed);
        }

        JsonNode connections = root.get(WorkflowDocument.CONNECTIONS);
        if (connections != null) {
            builder.connections(parseConnections(p, connections));
        }
        return builder.build();
    }

    private static Connections parseConnections(JsonParser p, JsonNode connections)
            throws IOException {
        if (!connections.isObject()) {
            throw new InvalidDocumentException(p, "'connections' must be an object");
        }

        Map<String, Map<String, List<List<Edge>>>> outputs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> sources = connections.fields();
        while (sources.hasNext()) {
            Map.Entry<String, JsonNode> source = sources.next();
            if (!source.getValue().isObject()) {
                throw new InvalidDocumentException(
                        p, "Connections of '" + source.getKey() + "' must be an object");
            }

            Map<String, List<List<Edge>>> byType = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> types = source.getValue().fields();
            while (types.hasNext()) {
                Map.Entry<String, JsonNode> type = types.next();
                byType.put(type.getKey(), parseSlots(p, source.getKey(), type));
            }
            outputs.put(source.getKey(), byType);
        }
        return Connections.of(outputs);
    }

    private static List<List<Edge>> parseSlots(
            JsonParser p, String source, Map.Entry<String, JsonNode> type) throws IOException {
        if (!type.getValue().isArray()) {
            throw new InvalidDocumentException(
                    p, "Outputs '" + type.getKey() + "' of '" + source + "' must be an array");
        }

        List<List<Edge>> slots = new ArrayList<>();
        for (JsonNode slot : type.getValue()) {
            List<Edge> edges = new ArrayList<>();
            if (slot.isArray()) {
                for (JsonNode edge : slot) {
                    if (!edge.isObject()) {
                        throw new InvalidDocumentException(
                                p, "Connection entry of '" + source + "' must be an object");
                    }
                    JsonNode target = edge.get("node");
                    edges.add(
                            new Edge(
                                    target != null && target.isTextual() ? target.asText() : null,
                                    edge.path("type").asText(type.getKey()),
                                    edge.path("index").asInt(0)));
                }
            } else if (!slot.isNull()) {
                throw new InvalidDocumentException(
                        p, "Output slot of '" + source + "' must be an array");
            }
            slots.add(slot.isNull() ? null : edges);
        }
        return slots;
    }
}
