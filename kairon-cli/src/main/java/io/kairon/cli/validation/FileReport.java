package io.kairon.cli.validation;

import io.kairon.core.result.ValidationResult;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/// Outcome of validating one workflow file.
///
/// @param path the validated file, not null
/// @param result final validation result; after an auto-fix, the result of the
///     re-validation, not null
/// @param removedNodes dead nodes removed from the file by the auto-fix, empty otherwise
public record FileReport(Path path, ValidationResult result, SortedSet<String> removedNodes) {

    public FileReport {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(result, "result must not be null");
        removedNodes = Collections.unmodifiableSortedSet(new TreeSet<>(removedNodes));
    }

    public static FileReport of(Path path, ValidationResult result) {
        return new FileReport(path, result, new TreeSet<>());
    }

    public boolean fixed() {
        return !removedNodes.isEmpty();
    }
}
