package io.kairon.core.rule;

import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.result.Severity;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.util.Objects;
import java.util.Optional;

/// Read-only inputs of a rule evaluation, plus diagnostic factories.
///
/// Node-level diagnostics are prefixed with the quoted node name, so that every message
/// identifies its node without the caller repeating it.
public final class RuleContext {

    private final WorkflowDocument document;
    private final WorkflowRegistry registry;
    private final String workflowName;

    public RuleContext(WorkflowDocument document, WorkflowRegistry registry, String workflowName) {
        this.document = Objects.requireNonNull(document, "document must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.workflowName = Objects.requireNonNull(workflowName, "workflowName must not be null");
    }

    public WorkflowDocument getDocument() {
        return document;
    }

    public WorkflowRegistry getRegistry() {
        return registry;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public Optional<Node> findNode(String name) {
        return document.findNode(name);
    }

    public Diagnostic error(Rule rule, Node node, String message) {
        return diagnostic(Severity.ERROR, rule, node, message);
    }

    public Diagnostic warning(Rule rule, Node node, String message) {
        return diagnostic(Severity.WARNING, rule, node, message);
    }

    public Diagnostic info(Rule rule, Node node, String message) {
        return diagnostic(Severity.INFO, rule, node, message);
    }

    /// Creates a diagnostic for the rule.
    ///
    /// @param severity finding severity, not null
    /// @param rule producing rule, not null
    /// @param node offending node, or null for a document-level finding
    /// @param message description without the node name
    /// @return diagnostic, never null
    public Diagnostic diagnostic(Severity severity, Rule rule, Node node, String message) {
        if (node == null) {
            return new Diagnostic(severity, rule.getId(), workflowName, null, message);
        }
        return new Diagnostic(
                severity,
                rule.getId(),
                workflowName,
                node.getName(),
                "'" + node.getName() + "': " + message);
    }
}
