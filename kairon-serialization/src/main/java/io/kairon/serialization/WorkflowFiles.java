package io.kairon.serialization;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

/// Discovers workflow files in a project directory.
///
/// Only top-level `*.json` regular files count; subdirectories such as test fixtures
/// are not scanned.
public final class WorkflowFiles {

    static final String EXTENSION = ".json";

    private WorkflowFiles() {}

    /// Lists the workflow files of a directory in file-name order.
    ///
    /// @param directory directory to scan, not null
    /// @return sorted paths, empty if the directory does not exist
    /// @throws IOException if the directory cannot be listed
    public static List<Path> list(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        }
    }
}
