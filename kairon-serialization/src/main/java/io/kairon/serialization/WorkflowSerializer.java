package io.kairon.serialization;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.kairon.core.exception.WorkflowNotFoundException;
import io.kairon.core.exception.WorkflowParseException;
import io.kairon.core.exception.WorkflowWriteException;
import io.kairon.core.workflow.WorkflowDocument;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/// Utility class for reading and writing exported workflow files.
///
/// Reading preserves every property of the file and its order; writing renders the
/// document in the two-space layout of the export format, so an auto-fixed file differs
/// from its original only by the removed nodes and connections.
///
/// ### Usage
/// {@snippet :
/// WorkflowDocument document = WorkflowSerializer.read(Path.of("n8n-workflows/Order_Flow.json"));
/// WorkflowDocument fixed = linter.fix(document, result.getDeadNodes());
/// WorkflowSerializer.write(fixed, Path.of("n8n-workflows/Order_Flow.json"));
/// }
///
/// @implNote Thread-safe. A single configured mapper is shared by all calls.
///
/// @see KaironJacksonModule for the registered type handlers
public final class WorkflowSerializer {

    private static final ObjectMapper MAPPER = createMapper();
    private static final ObjectWriter WRITER = MAPPER.writer(new WorkflowPrettyPrinter());

    private WorkflowSerializer() {}

    /// Parses a workflow document from JSON text.
    ///
    /// @param json JSON text, not null
    /// @return parsed document, never null
    /// @throws WorkflowParseException if the text is not JSON or not a workflow document
    public static WorkflowDocument fromJson(String json) throws WorkflowParseException {
        WorkflowDocument document;
        try {
            document = MAPPER.readValue(json, WorkflowDocument.class);
        } catch (InvalidDocumentException e) {
            throw new WorkflowParseException(
                    "Invalid workflow document: " + e.getOriginalMessage(), e);
        } catch (JsonProcessingException e) {
            throw new WorkflowParseException("Invalid JSON: " + describe(e), e);
        }
        if (document == null) {
            throw new WorkflowParseException(
                    "Invalid workflow document: Workflow root must be a JSON object");
        }
        return document;
    }

    /// Reads and parses a workflow file.
    ///
    /// @param path file to read, not null
    /// @return parsed document, never null
    /// @throws WorkflowNotFoundException if the file does not exist
    /// @throws WorkflowParseException if the file cannot be read or parsed
    public static WorkflowDocument read(Path path)
            throws WorkflowNotFoundException, WorkflowParseException {
        if (!Files.exists(path)) {
            throw new WorkflowNotFoundException("File not found: " + path);
        }
        String json;
        try {
            json = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new WorkflowNotFoundException("File not found: " + path);
        } catch (IOException e) {
            throw new WorkflowParseException("Cannot read file: " + e.getMessage(), e);
        }
        return fromJson(json);
    }

    /// Renders a document as two-space indented JSON.
    ///
    /// @param document the document to render, not null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(WorkflowDocument document) {
        try {
            return WRITER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize workflow: " + e.getMessage(), e);
        }
    }

    /// Overwrites a file with the rendered document.
    ///
    /// @param document the document to write, not null
    /// @param path target file, not null
    /// @throws WorkflowWriteException if the file cannot be written
    public static void write(WorkflowDocument document, Path path) throws WorkflowWriteException {
        try {
            Files.writeString(path, toJson(document), StandardCharsets.UTF_8);
        } catch (IOException | IllegalArgumentException e) {
            throw new WorkflowWriteException("Cannot write " + path + ": " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for workflow documents.
    ///
    /// Registers:
    /// - `KaironJacksonModule` for the document and node handlers
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - `USE_BIG_DECIMAL_FOR_FLOATS` left off, so `typeVersion` values read as doubles
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new KaironJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static String describe(JsonProcessingException e) {
        JsonLocation location = e.getLocation();
        if (location == null || location.getLineNr() < 0) {
            return e.getOriginalMessage();
        }
        return e.getOriginalMessage()
                + " (line " + location.getLineNr() + ", column " + location.getColumnNr() + ")";
    }
}
