package io.kairon.core.rule;

import io.kairon.core.LinterConfig;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.document.ConnectionIntegrityRule;
import io.kairon.core.rule.document.CtxInitializationRule;
import io.kairon.core.rule.document.DocumentStructureRule;
import io.kairon.core.rule.document.DuplicateWorkflowNameRule;
import io.kairon.core.rule.document.ErrorWorkflowRule;
import io.kairon.core.rule.node.CodeInputAccessRule;
import io.kairon.core.rule.node.CodeReturnShapeRule;
import io.kairon.core.rule.node.CtxConventionRule;
import io.kairon.core.rule.node.CtxEventFieldsRule;
import io.kairon.core.rule.node.CtxNamespaceRule;
import io.kairon.core.rule.node.DiscordCtxRule;
import io.kairon.core.rule.node.EmptyTriggerRule;
import io.kairon.core.rule.node.IfCtxConditionRule;
import io.kairon.core.rule.node.MergeConfigRule;
import io.kairon.core.rule.node.NodeReferenceFanOutRule;
import io.kairon.core.rule.node.NodeShapeRule;
import io.kairon.core.rule.node.PostgresCtxRule;
import io.kairon.core.rule.node.SetPreservesCtxRule;
import io.kairon.core.rule.node.SubWorkflowReferenceRule;
import io.kairon.core.rule.node.SwitchFallbackRule;
import io.kairon.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/// Default implementation of RuleEngine.
///
/// Registers all built-in rules except those disabled in the [LinterConfig], and
/// dispatches node rules by simplified node type. Custom rules can be registered to
/// extend the checks.
///
/// All built-in rules are stateless, so one engine can evaluate many documents
/// concurrently once registration is complete.
public class DefaultRuleEngine implements RuleEngine {

    private static final Logger logger = Logger.getLogger(DefaultRuleEngine.class.getName());

    private final Map<String, NodeRule> nodeRules = new LinkedHashMap<>();
    private final Map<String, DocumentRule> documentRules = new LinkedHashMap<>();
    private final Set<String> disabled;

    /// Creates an engine with all built-in rules and default conventions.
    public DefaultRuleEngine() {
        this(LinterConfig.defaults());
    }

    /// Creates an engine with the built-in rules configured from the config.
    ///
    /// @param config conventions and disabled rule ids, not null
    public DefaultRuleEngine(LinterConfig config) {
        this.disabled = Set.copyOf(config.getDisabledRules());

        register(new NodeShapeRule());
        register(new EmptyTriggerRule());
        register(new SubWorkflowReferenceRule());
        register(new SwitchFallbackRule());
        register(new CodeReturnShapeRule());
        register(new CodeInputAccessRule());
        register(new CtxConventionRule(new NamePrefixExemption(config.getPreContextPrefixes())));
        register(
                new CtxNamespaceRule(
                        config.getApprovedNamespaces(), config.getToleratedNamespaces()));
        register(new CtxEventFieldsRule());
        register(new MergeConfigRule());
        register(new NodeReferenceFanOutRule());
        register(new IfCtxConditionRule());
        register(new PostgresCtxRule(config.getDatabaseWorkflow()));
        register(new DiscordCtxRule());
        register(new SetPreservesCtxRule());

        register(new DocumentStructureRule());
        register(new ConnectionIntegrityRule());
        register(new CtxInitializationRule(config.getReachabilityPolicy()));
        register(new ErrorWorkflowRule());
        register(new DuplicateWorkflowNameRule());
    }

    @Override
    public void register(NodeRule rule) {
        if (isDisabled(rule)) {
            return;
        }
        nodeRules.put(rule.getId(), rule);
    }

    @Override
    public void register(DocumentRule rule) {
        if (isDisabled(rule)) {
            return;
        }
        documentRules.put(rule.getId(), rule);
    }

    @Override
    public List<Diagnostic> evaluate(RuleContext context) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Node node : context.getDocument().getNodes()) {
            for (NodeRule rule : nodeRules.values()) {
                if (appliesTo(rule, node)) {
                    diagnostics.addAll(rule.check(node, context));
                }
            }
        }
        for (DocumentRule rule : documentRules.values()) {
            diagnostics.addAll(rule.check(context));
        }
        return diagnostics;
    }

    @Override
    public Set<String> getRuleIds() {
        Set<String> ids = new LinkedHashSet<>(nodeRules.keySet());
        ids.addAll(documentRules.keySet());
        return ids;
    }

    private boolean isDisabled(Rule rule) {
        if (rule == null || rule.getId() == null || rule.getId().isBlank()) {
            throw new IllegalArgumentException("rule must have a non-blank id");
        }
        if (disabled.contains(rule.getId())) {
            logger.fine(() -> "Rule disabled by configuration: " + rule.getId());
            return true;
        }
        return false;
    }

    private static boolean appliesTo(NodeRule rule, Node node) {
        Set<String> types = rule.getNodeTypes();
        return types.isEmpty() || types.contains(node.getSimpleType());
    }
}
