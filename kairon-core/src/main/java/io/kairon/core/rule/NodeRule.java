package io.kairon.core.rule;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.workflow.node.Node;
import java.util.List;
import java.util.Set;

/// Rule evaluated once per node of matching type.
///
/// Implementations must be stateless and side-effect free: the engine may evaluate the
/// same rule instance for many documents concurrently. A rule that finds its inputs
/// absent or malformed returns no diagnostics rather than failing.
///
/// @see RuleEngine#register(NodeRule)
public interface NodeRule extends Rule {

    /// Returns the simplified node types this rule applies to.
    ///
    /// @return simplified types, or an empty set to apply to every node
    Set<String> getNodeTypes();

    /// Checks one node.
    ///
    /// @param node the node, type matches [#getNodeTypes()], not null
    /// @param context document and registry, not null
    /// @return findings, empty if none, never null
    List<Diagnostic> check(Node node, RuleContext context);
}
