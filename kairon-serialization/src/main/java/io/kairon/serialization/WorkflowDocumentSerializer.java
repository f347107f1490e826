package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a workflow document in its original top-level property order.
///
/// `nodes` and `connections` are written from the current model, so a fixed document
/// reflects its removals; every other property is written back verbatim.
///
/// @implNote Package-private. Registered by {@link KaironJacksonModule}.
/// @see WorkflowDocumentDeserializer for the inverse operation
class WorkflowDocumentSerializer extends StdSerializer<WorkflowDocument> {

    @Serial private static final long serialVersionUID = -1417739468120394455L;

    WorkflowDocumentSerializer() {
        super(WorkflowDocument.class);
    }

    @Override
    public void serialize(WorkflowDocument document, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, Object> property : document.getAttributes().entrySet()) {
            gen.writeFieldName(property.getKey());
            switch (property.getKey()) {
                case WorkflowDocument.NODES -> {
                    gen.writeStartArray();
                    for (Node node : document.getNodes()) {
                        provider.defaultSerializeValue(node, gen);
                    }
                    gen.writeEndArray();
                }
                case WorkflowDocument.CONNECTIONS ->
                        provider.defaultSerializeValue(document.getConnections().toMap(), gen);
                default -> provider.defaultSerializeValue(property.getValue(), gen);
            }
        }
        gen.writeEndObject();
    }
}
