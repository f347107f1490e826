package io.kairon.core.rule.node;

import io.kairon.core.workflow.node.Node;

/// Execution modes and source of code nodes.
final class CodeModes {

    static final String PER_ITEM = "runOnceForEachItem";
    static final String ALL_ITEMS = "runOnceForAllItems";

    private CodeModes() {}

    /// @return declared mode, [#ALL_ITEMS] when unset
    static String mode(Node node) {
        String mode = node.getParameters().getString("mode");
        return mode != null ? mode : ALL_ITEMS;
    }

    static boolean isPerItem(Node node) {
        return PER_ITEM.equals(mode(node));
    }

    /// @return JavaScript source, empty if absent
    static String jsCode(Node node) {
        return node.getParameters().getStringOrEmpty("jsCode");
    }
}
