package io.kairon.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.io.Serial;

/// Jackson `SimpleModule` registering the workflow serializer/deserializer pairs.
///
/// - `WorkflowDocument`: `WorkflowDocumentSerializer` / `WorkflowDocumentDeserializer`
/// - `Node`: `NodeSerializer` / `NodeDeserializer`
///
/// @implNote All registrations are explicit, no classpath scanning.
/// @see WorkflowSerializer for the convenience factory API
public class KaironJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3935570012818645081L;

    public KaironJacksonModule() {
        super("KaironJacksonModule");

        addSerializer(WorkflowDocument.class, new WorkflowDocumentSerializer());
        addDeserializer(WorkflowDocument.class, new WorkflowDocumentDeserializer());

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());
    }
}
