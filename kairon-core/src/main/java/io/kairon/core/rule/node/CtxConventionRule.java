package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.CodePattern;
import io.kairon.core.rule.NamePrefixExemption;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/// Enforces the context-object convention in code nodes.
///
/// Code nodes pass data downstream inside one `ctx` object (`{ctx: {...$json.ctx,
/// llm: {...}}}`) instead of flat top-level fields. Legacy flat returns and spreads of
/// the whole input are errors; reading flat `$json.x` fields without producing a
/// `ctx` is a warning.
///
/// ### Exemptions
/// - nodes matching the pre-context [NamePrefixExemption], which run before `ctx` exists
/// - pass-through and very short nodes, for the flat-access warning only
///
/// @see CtxNamespaceRule
public class CtxConventionRule implements NodeRule {

    public static final String ID = "ctx-convention";

    static final List<CodePattern> LEGACY_PATTERNS =
            List.of(
                    CodePattern.of(
                            "return\\s*\\{\\s*response:",
                            "returns flat {response:} instead of {ctx: {..., response:}}"),
                    CodePattern.of(
                            "return\\s*\\{\\s*error:",
                            "returns flat {error:} instead of {ctx: {..., validation:}}"),
                    CodePattern.of(
                            "return\\s*\\{\\s*valid:",
                            "returns flat {valid:} instead of {ctx: {..., validation:}}"),
                    CodePattern.of(
                            "\\.\\.\\.\\$json(?!\\s*\\.ctx)", "spreads $json instead of $json.ctx"),
                    CodePattern.of(
                            "return\\s*\\{\\s*\\.\\.\\.\\s*event",
                            "returns {...event} instead of ctx pattern"));

    static final CodePattern FLAT_ACCESS =
            CodePattern.of("\\$json\\.(?!ctx)[a-z_]+(?!\\s*\\|\\|)", "may be using flat data access");

    private static final int MIN_CHECKED_LENGTH = 50;

    private final NamePrefixExemption exemption;

    public CtxConventionRule() {
        this(NamePrefixExemption.defaults());
    }

    public CtxConventionRule(NamePrefixExemption exemption) {
        this.exemption = Objects.requireNonNull(exemption, "exemption must not be null");
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Set<String> getNodeTypes() {
        return Set.of(NodeTypes.CODE);
    }

    @Override
    public List<Diagnostic> check(Node node, RuleContext context) {
        String code = CodeModes.jsCode(node);
        if (code.isBlank() || exemption.isExempt(node.getName())) {
            return List.of();
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        for (CodePattern legacy : LEGACY_PATTERNS) {
            if (legacy.matches(code)) {
                diagnostics.add(context.error(this, node, legacy.message()));
            }
        }

        if (code.toLowerCase(Locale.ROOT).contains("passthrough")
                || code.length() < MIN_CHECKED_LENGTH) {
            return diagnostics;
        }
        if (FLAT_ACCESS.matches(code) && !code.contains("ctx:")) {
            diagnostics.add(context.warning(this, node, FLAT_ACCESS.message()));
        }
        return diagnostics;
    }
}
