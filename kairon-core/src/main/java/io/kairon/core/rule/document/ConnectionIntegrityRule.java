package io.kairon.core.rule.document;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.DocumentRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.connection.Connection;
import io.kairon.core.workflow.connection.Connections;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/// Every connection source and target must name an existing node.
public class ConnectionIntegrityRule implements DocumentRule {

    public static final String ID = "connection-integrity";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public List<Diagnostic> check(RuleContext context) {
        Set<String> names = context.getDocument().nodeNames();
        Connections connections = context.getDocument().getConnections();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (String source : connections.sources()) {
            if (!names.contains(source)) {
                diagnostics.add(
                        context.error(this, null, "Connection from non-existent node: '" + source + "'"));
            }
        }
        for (Connection connection : connections.all()) {
            String target = connection.target();
            if (target != null && !names.contains(target)) {
                diagnostics.add(
                        context.error(
                                this,
                                null,
                                "Connection to non-existent node: '"
                                        + connection.source()
                                        + "' -> '"
                                        + target
                                        + "'"));
            }
        }
        return diagnostics;
    }
}
