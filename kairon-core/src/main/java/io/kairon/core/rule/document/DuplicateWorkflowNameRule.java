package io.kairon.core.rule.document;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.DocumentRule;
import io.kairon.core.rule.RuleContext;
import java.util.List;

/// Sub-workflow calls resolve by name, so a name shared by several files is ambiguous.
public class DuplicateWorkflowNameRule implements DocumentRule {

    public static final String ID = "duplicate-workflow-name";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(RuleContext context) {
        int occurrences = context.getRegistry().occurrences(context.getWorkflowName());
        if (occurrences <= 1) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        null,
                        "Workflow name '"
                                + context.getWorkflowName()
                                + "' is used by "
                                + occurrences
                                + " documents in the project"));
    }
}
