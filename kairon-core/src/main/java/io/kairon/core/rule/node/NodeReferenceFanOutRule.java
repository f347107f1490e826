package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Warns about code nodes reading many upstream nodes by name via `$('Node')`.
public class NodeReferenceFanOutRule implements NodeRule {

    public static final String ID = "node-reference-fan-out";

    private static final Pattern NODE_REFERENCE = Pattern.compile("\\$\\('([^']+)'\\)");
    private static final int MAX_REFERENCES = 2;

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
        Matcher matcher = NODE_REFERENCE.matcher(CodeModes.jsCode(node));
        int references = 0;
        while (matcher.find()) {
            references++;
        }
        if (references <= MAX_REFERENCES) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        node,
                        "has "
                                + references
                                + " node references - consider using ctx pattern to reduce coupling"));
    }
}
