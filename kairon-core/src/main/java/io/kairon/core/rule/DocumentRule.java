package io.kairon.core.rule;

import io.kairon.core.result.Diagnostic;
import java.util.List;

/// Rule evaluated once per document, for checks spanning several nodes.
public interface DocumentRule extends Rule {

    /// @param context document and registry, not null
    /// @return findings, empty if none, never null
    List<Diagnostic> check(RuleContext context);
}
