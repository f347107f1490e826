package io.kairon.core.rule.document;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.DocumentRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Checks the top-level keys and node name uniqueness of a document.
///
/// Connections address nodes by name, so a duplicated name makes every edge to it
/// ambiguous.
public class DocumentStructureRule implements DocumentRule {

    public static final String ID = "document-structure";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(RuleContext context) {
        WorkflowDocument document = context.getDocument();
        List<Diagnostic> diagnostics = new ArrayList<>();
        if (!document.declaresNodes()) {
            diagnostics.add(context.error(this, null, "Missing required top-level key 'nodes'"));
        }
        if (!document.declaresConnections()) {
            diagnostics.add(
                    context.error(this, null, "Missing required top-level key 'connections'"));
        }

        Map<String, Integer> occurrences = new LinkedHashMap<>();
        for (Node node : document.getNodes()) {
            occurrences.merge(node.getName(), 1, Integer::sum);
        }
        occurrences.forEach(
                (name, count) -> {
                    if (count > 1) {
                        diagnostics.add(
                                context.error(
                                        this,
                                        null,
                                        "Duplicate node name '" + name + "' (" + count + " nodes)"));
                    }
                });
        return diagnostics;
    }
}
