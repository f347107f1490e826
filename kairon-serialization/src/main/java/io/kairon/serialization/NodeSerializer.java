package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.kairon.core.workflow.node.Node;
import java.io.IOException;
import java.io.Serial;

/// Writes a node exactly as it was read: its raw properties in source order.
///
/// @implNote Package-private. Registered by {@link KaironJacksonModule}.
/// @see NodeDeserializer for the inverse operation
class NodeSerializer extends StdSerializer<Node> {

    @Serial private static final long serialVersionUID = 2290417795006425519L;

    NodeSerializer() {
        super(Node.class);
    }

    @Override
    public void serialize(Node node, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        provider.defaultSerializeValue(node.getAttributes(), gen);
    }
}
