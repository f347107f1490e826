package io.kairon.core.graph;

import io.kairon.core.result.Diagnostic;
import io.kairon.core.workflow.WorkflowDocument;
import io.kairon.core.workflow.node.Node;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Finds nodes that can never execute because no trigger reaches them.
///
/// ### Algorithm
/// 1. Collect triggers per [ReachabilityPolicy#isTrigger(Node)].
/// 2. Breadth-first search from all triggers over every connection type and output slot,
///    with a visited set, so cycles terminate.
/// 3. Dead nodes are all nodes not visited.
/// 4. If any visited node is an AI chain, every language model node is treated as live:
///    models are wired into chains rather than reached from them.
///
/// A document without triggers yields a warning; every node is then reported dead.
///
/// @implNote Stateless and thread-safe.
public class GraphAnalyzer {

    public static final String RULE_ID = "reachability";
    public static final String NO_TRIGGERS = "No trigger nodes found in workflow";

    private static final Logger logger = Logger.getLogger(GraphAnalyzer.class.getName());

    private final ReachabilityPolicy policy;

    public GraphAnalyzer() {
        this(ReachabilityPolicy.defaults());
    }

    public GraphAnalyzer(ReachabilityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public ReachabilityPolicy getPolicy() {
        return policy;
    }

    /// Analyzes reachability of a document.
    ///
    /// @param document document to analyze, not null
    /// @param workflowName display name used in diagnostics, not null
    /// @return analysis, never null
    public GraphAnalysis findDeadCode(WorkflowDocument document, String workflowName) {
        Set<String> names = document.nodeNames();
        List<String> triggers = new ArrayList<>();
        for (Node node : document.getNodes()) {
            if (policy.isTrigger(node) && !triggers.contains(node.getName())) {
                triggers.add(node.getName());
            }
        }

        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(triggers);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (!visited.add(current)) {
                continue;
            }
            for (String target : document.getConnections().targetsOf(current)) {
                if (names.contains(target) && !visited.contains(target)) {
                    queue.add(target);
                }
            }
        }

        SortedSet<String> dead = new TreeSet<>(names);
        dead.removeAll(visited);

        boolean chainReached =
                document.getNodes().stream()
                        .anyMatch(n -> visited.contains(n.getName()) && policy.isChain(n));
        if (chainReached) {
            document.getNodes().stream()
                    .filter(policy::isModel)
                    .forEach(n -> dead.remove(n.getName()));
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        if (triggers.isEmpty()) {
            diagnostics.add(Diagnostic.warning(RULE_ID, workflowName, NO_TRIGGERS));
        }

        logger.fine(
                () ->
                        workflowName
                                + ": "
                                + triggers.size()
                                + " trigger(s), "
                                + visited.size()
                                + " reachable, "
                                + dead.size()
                                + " dead");
        return new GraphAnalysis(dead, triggers, visited, diagnostics);
    }
}
