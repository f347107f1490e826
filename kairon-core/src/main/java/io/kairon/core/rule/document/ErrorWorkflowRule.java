package io.kairon.core.rule.document;

import io.kairon.core.registry.WorkflowRegistry;
import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.DocumentRule;
import io.kairon.core.rule.RuleContext;
import java.util.List;

/// `settings.errorWorkflow` must point at a workflow id present in the project.
///
/// Only checked when the registry indexed ids; exports without ids cannot be resolved.
public class ErrorWorkflowRule implements DocumentRule {

    public static final String ID = "error-workflow";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(RuleContext context) {
        if (!(context.getDocument().getSettings().get("errorWorkflow") instanceof String id)
                || id.isBlank()) {
            return List.of();
        }
        WorkflowRegistry registry = context.getRegistry();
        if (!registry.hasIds() || registry.containsId(id)) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        null,
                        "settings.errorWorkflow references workflow id '"
                                + id
                                + "' which is not present in the project"));
    }
}
