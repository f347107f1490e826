package io.kairon.core.workflow.node;

/// Simplified node type names the linter dispatches on.
///
/// A node `type` is namespaced by its package (`n8n-nodes-base.switch`,
/// `@n8n/n8n-nodes-langchain.chainLlm`); rules only care about the last segment.
public final class NodeTypes {

    public static final String CODE = "code";
    public static final String SWITCH = "switch";
    public static final String IF = "if";
    public static final String MERGE = "merge";
    public static final String SET = "set";
    public static final String POSTGRES = "postgres";
    public static final String DISCORD = "discord";
    public static final String EXECUTE_WORKFLOW = "executeWorkflow";
    public static final String EXECUTE_WORKFLOW_TRIGGER = "executeWorkflowTrigger";

    private NodeTypes() {}

    /// Returns the last dot-separated segment of a node type.
    ///
    /// @param type namespaced node type, may be null
    /// @return simplified type, empty if the type is null
    public static String simpleName(String type) {
        if (type == null) {
            return "";
        }
        int lastDot = type.lastIndexOf('.');
        return lastDot < 0 ? type : type.substring(lastDot + 1);
    }

    /// Checks whether a type carries a package namespace.
    ///
    /// @param type node type, may be null
    /// @return true if the type contains a dot
    public static boolean isNamespaced(String type) {
        return type != null && type.indexOf('.') >= 0;
    }
}
