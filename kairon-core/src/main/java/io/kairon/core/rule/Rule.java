package io.kairon.core.rule;

/// Common contract of lint rules.
///
/// @see NodeRule
/// @see DocumentRule
public interface Rule {

    /// Returns the stable identifier used in reports and to disable the rule.
    ///
    /// @return kebab-case rule id, never null
    String getId();
}
