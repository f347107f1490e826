package io.kairon.core.rule;

import io.kairon.core.result.Diagnostic;
import java.util.List;
import java.util.Set;

/// Registry of lint rules and their dispatch over a document.
///
/// @see DefaultRuleEngine for the built-in rule set
public interface RuleEngine {

    /// Registers a node rule, replacing any rule with the same id.
    void register(NodeRule rule);

    /// Registers a document rule, replacing any rule with the same id.
    void register(DocumentRule rule);

    /// Evaluates every registered rule against the document in the context.
    ///
    /// Node rules run per node in document order, then document rules run.
    ///
    /// @param context document and registry, not null
    /// @return all findings, never null
    List<Diagnostic> evaluate(RuleContext context);

    /// @return ids of all registered rules
    Set<String> getRuleIds();
}
