package io.kairon.core.graph;

import io.kairon.core.result.Diagnostic;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/// Reachability facts of one document.
///
/// @param deadNodes names of nodes unreachable from any trigger, sorted
/// @param triggers trigger node names in document order
/// @param reachable names visited from the triggers
/// @param diagnostics findings of the analysis itself, e.g. a missing trigger
public record GraphAnalysis(
        SortedSet<String> deadNodes,
        List<String> triggers,
        Set<String> reachable,
        List<Diagnostic> diagnostics) {

    public GraphAnalysis {
        deadNodes = Collections.unmodifiableSortedSet(new TreeSet<>(deadNodes));
        triggers = List.copyOf(triggers);
        reachable = Collections.unmodifiableSet(reachable);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasDeadCode() {
        return !deadNodes.isEmpty();
    }

    public boolean isDead(String nodeName) {
        return deadNodes.contains(nodeName);
    }
}
