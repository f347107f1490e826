package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;
import java.io.Serial;

/// Signals well-formed JSON whose shape is not a workflow document.
///
/// @implNote Package-private. Thrown by the deserializers and translated to
/// `WorkflowParseException` by {@link WorkflowSerializer}.
class InvalidDocumentException extends JsonMappingException {

    @Serial private static final long serialVersionUID = 5104838815590712301L;

    InvalidDocumentException(JsonParser parser, String message) {
        super(parser, message);
    }
}
