package io.kairon.core.rule.node;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.rule.NodeRule;
import io.kairon.core.rule.RuleContext;
import io.kairon.core.workflow.node.Node;
import io.kairon.core.workflow.node.NodeTypes;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Warns about `ctx.<namespace>` accesses outside the agreed namespace vocabulary.
public class CtxNamespaceRule implements NodeRule {

    public static final String ID = "ctx-namespace";

    private static final Pattern CTX_ACCESS = Pattern.compile("\\.ctx\\.(\\w+)");

    private final List<String> approved;
    private final Set<String> tolerated;

    public CtxNamespaceRule(List<String> approved, List<String> tolerated) {
        this.approved = List.copyOf(approved);
        this.tolerated = Set.copyOf(tolerated);
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
        Set<String> unapproved = new TreeSet<>();
        Matcher matcher = CTX_ACCESS.matcher(CodeModes.jsCode(node));
        while (matcher.find()) {
            String namespace = matcher.group(1);
            if (!approved.contains(namespace) && !tolerated.contains(namespace)) {
                unapproved.add(namespace);
            }
        }
        if (unapproved.isEmpty()) {
            return List.of();
        }
        return List.of(
                context.warning(
                        this,
                        node,
                        "uses non-standard ctx namespace(s): "
                                + String.join(", ", unapproved)
                                + " - consider using: "
                                + String.join(", ", approved)));
    }
}
