package io.kairon.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.kairon.core.WorkflowLinter;
import io.kairon.core.registry.RegistryEntry;
import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.workflow.WorkflowDocument;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Builds the project-wide {@link WorkflowRegistry} from a workflow directory.
///
/// Every top-level workflow file contributes one entry. Only the header properties are
/// read (`name`, `id`, `isArchived`); a file without a string `name` is registered under
/// its file stem. Unreadable or non-object files are skipped with a log message, since
/// the same files are reported properly when they are validated.
public final class WorkflowRegistryLoader {

    private static final Logger logger = Logger.getLogger(WorkflowRegistryLoader.class.getName());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private WorkflowRegistryLoader() {}

    /// Scans a directory for workflow files.
    ///
    /// @param directory project workflow directory, not null
    /// @return registry of the readable files, empty if the directory is missing
    public static WorkflowRegistry build(Path directory) {
        List<Path> files;
        try {
            files = WorkflowFiles.list(directory);
        } catch (IOException e) {
            logger.warning("Cannot list workflow directory " + directory + ": " + e.getMessage());
            return WorkflowRegistry.empty();
        }

        List<RegistryEntry> entries = new ArrayList<>();
        for (Path file : files) {
            RegistryEntry entry = readEntry(file);
            if (entry != null) {
                entries.add(entry);
            }
        }
        logger.fine(() -> "Registered " + entries.size() + " workflow(s) from " + directory);
        return WorkflowRegistry.of(entries);
    }

    private static RegistryEntry readEntry(Path file) {
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            logger.fine(() -> "Skipping unreadable workflow " + file + ": " + e.getMessage());
            return null;
        }
        if (root == null || !root.isObject()) {
            logger.fine(() -> "Skipping non-object workflow " + file);
            return null;
        }

        JsonNode name = root.get(WorkflowDocument.NAME);
        JsonNode id = root.get(WorkflowDocument.ID);
        return new RegistryEntry(
                name != null && name.isTextual()
                        ? name.asText()
                        : WorkflowLinter.stem(file.getFileName().toString()),
                id != null && id.isValueNode() && !id.isNull() ? id.asText() : null,
                root.path(WorkflowDocument.ARCHIVED).asBoolean(false));
    }
}
