package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import java.io.IOException;
import java.io.Serial;

/// Pretty printer matching the layout of exported workflow files.
///
/// Two-space indentation for objects and arrays, `"key": value` separators and `{}` /
/// `[]` for empty containers, so that a rewritten file diffs only where content changed.
class WorkflowPrettyPrinter extends DefaultPrettyPrinter {

    @Serial private static final long serialVersionUID = -4480781313702217045L;

    private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

    WorkflowPrettyPrinter() {
        indentObjectsWith(INDENTER);
        indentArraysWith(INDENTER);
    }

    private WorkflowPrettyPrinter(WorkflowPrettyPrinter base) {
        super(base);
    }

    @Override
    public DefaultPrettyPrinter createInstance() {
        return new WorkflowPrettyPrinter(this);
    }

    @Override
    public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
        g.writeRaw(": ");
    }

    @Override
    public void writeEndObject(JsonGenerator g, int nrOfEntries) throws IOException {
        if (!_objectIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfEntries > 0) {
            _objectIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw('}');
    }

    @Override
    public void writeEndArray(JsonGenerator g, int nrOfValues) throws IOException {
        if (!_arrayIndenter.isInline()) {
            --_nesting;
        }
        if (nrOfValues > 0) {
            _arrayIndenter.writeIndentation(g, _nesting);
        }
        g.writeRaw(']');
    }
}
