package io.kairon.core.fix;

import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Removes unreachable nodes and every connection touching them.
///
/// Only dead nodes, their source entries and edges pointing at them change; node
/// objects, slot positions and all other document properties are kept as read. Fixing a
/// fixed document is a no-op.
///
/// @see io.kairon.core.graph.GraphAnalyzer#findDeadCode
public class DeadCodeFixer {

    private static final Logger logger = Logger.getLogger(DeadCodeFixer.class.getName());

    /// Returns the document without the given nodes.
    ///
    /// @param document document to fix, not null
    /// @param deadNodes names of nodes to remove, not null
    /// @return fixed document, the same instance if nothing is removed
    public WorkflowDocument fix(WorkflowDocument document, Set<String> deadNodes) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(deadNodes, "deadNodes must not be null");
        if (deadNodes.isEmpty()) {
            return document;
        }

        List<Node> survivors =
                document.getNodes().stream().filter(n -> !deadNodes.contains(n.getName())).toList();
        int removed = document.getNodes().size() - survivors.size();
        logger.fine(() -> "Removing " + removed + " dead node(s): " + deadNodes);

        return document.withGraph(survivors, document.getConnections().without(deadNodes));
    }
}
