package io.kairon.core.result;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/// Outcome of analyzing one workflow document.
///
/// Diagnostics are split by severity and keep the order they were added in. A document
/// passes when it has no errors; warnings only matter under strict gating.
///
/// @implNote Immutable and thread-safe. [#withDiagnostic(Diagnostic)] returns a copy.
///
/// @see ResultAggregator for how results are assembled
/// @see ValidationSummary for reducing many results
public final class ValidationResult {

    private final String workflowName;
    private final String source;
    private final List<Diagnostic> errors;
    private final List<Diagnostic> warnings;
    private final List<Diagnostic> infos;
    private final SortedSet<String> deadNodes;

    private ValidationResult(Builder builder) {
        this.workflowName = Objects.requireNonNull(builder.workflowName, "workflowName required");
        this.source = builder.source != null ? builder.source : builder.workflowName;
        this.errors = List.copyOf(builder.errors);
        this.warnings = List.copyOf(builder.warnings);
        this.infos = List.copyOf(builder.infos);
        this.deadNodes = Collections.unmodifiableSortedSet(new TreeSet<>(builder.deadNodes));
    }

    public static Builder builder(String workflowName) {
        return new Builder(workflowName);
    }

    /// Creates a result holding a single fatal error, used for unreadable documents.
    ///
    /// @param workflowName display name, typically the file stem
    /// @param source file name the document was read from
    /// @param diagnostic the fatal error
    /// @return failed result, never null
    public static ValidationResult failure(
            String workflowName, String source, Diagnostic diagnostic) {
        return builder(workflowName).source(source).add(diagnostic).build();
    }

    /// @return display name of the document, never null
    public String getWorkflowName() {
        return workflowName;
    }

    /// @return source the document was read from, the workflow name if unknown
    public String getSource() {
        return source;
    }

    public List<Diagnostic> getErrors() {
        return errors;
    }

    public List<Diagnostic> getWarnings() {
        return warnings;
    }

    public List<Diagnostic> getInfos() {
        return infos;
    }

    /// Returns all diagnostics: errors first, then warnings, then infos.
    ///
    /// @return unmodifiable list, never null
    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> all = new ArrayList<>(errors);
        all.addAll(warnings);
        all.addAll(infos);
        return Collections.unmodifiableList(all);
    }

    /// @return names of unreachable nodes, sorted, never null
    public SortedSet<String> getDeadNodes() {
        return deadNodes;
    }

    public boolean passed() {
        return errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public ValidationStatus getStatus() {
        if (!errors.isEmpty()) {
            return ValidationStatus.FAIL;
        }
        return warnings.isEmpty() ? ValidationStatus.PASS : ValidationStatus.WARN;
    }

    /// Returns a copy with one more diagnostic.
    ///
    /// @param diagnostic finding to append, not null
    /// @return new result, never null
    public ValidationResult withDiagnostic(Diagnostic diagnostic) {
        Builder copy = builder(workflowName).source(source).deadNodes(deadNodes);
        getDiagnostics().forEach(copy::add);
        return copy.add(diagnostic).build();
    }

    @Override
    public String toString() {
        return "ValidationResult{workflow='"
                + workflowName
                + "', status="
                + getStatus()
                + ", errors="
                + errors.size()
                + ", warnings="
                + warnings.size()
                + "}";
    }

    public static final class Builder {
        private final String workflowName;
        private String source;
        private final List<Diagnostic> errors = new ArrayList<>();
        private final List<Diagnostic> warnings = new ArrayList<>();
        private final List<Diagnostic> infos = new ArrayList<>();
        private final SortedSet<String> deadNodes = new TreeSet<>();

        private Builder(String workflowName) {
            this.workflowName = workflowName;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder add(Diagnostic diagnostic) {
            switch (diagnostic.severity()) {
                case ERROR -> errors.add(diagnostic);
                case WARNING -> warnings.add(diagnostic);
                case INFO -> infos.add(diagnostic);
            }
            return this;
        }

        public Builder addAll(List<Diagnostic> diagnostics) {
            diagnostics.forEach(this::add);
            return this;
        }

        public Builder deadNodes(Collection<String> names) {
            this.deadNodes.addAll(names);
            return this;
        }

        public ValidationResult build() {
            return new ValidationResult(this);
        }
    }
}
