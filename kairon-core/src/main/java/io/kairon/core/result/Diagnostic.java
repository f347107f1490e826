package io.kairon.core.result;

import java.util.Objects;

/// A single finding produced while analyzing a workflow document.
///
/// The message is self-contained for display under the document heading; [#fullText()]
/// also names the document for contexts where findings of several documents are mixed,
/// such as logs.
///
/// @param severity finding severity, not null
/// @param ruleId stable id of the producing rule, not null
/// @param workflowName display name of the document, not null
/// @param nodeName name of the offending node, or null for document-level findings
/// @param message human-readable description, not null
public record Diagnostic(
        Severity severity, String ruleId, String workflowName, String nodeName, String message) {

    public Diagnostic {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(workflowName, "workflowName must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic error(String ruleId, String workflowName, String message) {
        return new Diagnostic(Severity.ERROR, ruleId, workflowName, null, message);
    }

    public static Diagnostic warning(String ruleId, String workflowName, String message) {
        return new Diagnostic(Severity.WARNING, ruleId, workflowName, null, message);
    }

    public static Diagnostic info(String ruleId, String workflowName, String message) {
        return new Diagnostic(Severity.INFO, ruleId, workflowName, null, message);
    }

    /// Returns the message prefixed with the document name and rule id.
    ///
    /// @return e.g. `[Order_Flow] ERROR dead-code: DEAD CODE: ...`
    public String fullText() {
        return "[" + workflowName + "] " + severity.label() + " " + ruleId + ": " + message;
    }
}
