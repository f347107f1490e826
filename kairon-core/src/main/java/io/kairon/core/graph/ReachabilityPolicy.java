package io.kairon.core.graph;

import io.kairon.core.workflow.node.Node;
import java.util.List;
import java.util.Objects;

/// Node-type vocabulary of reachability analysis.
///
/// - **Triggers**: a node whose full type contains one of the trigger keywords starts an
///   execution path (`webhook`, `scheduleTrigger`, `manualTrigger`,
///   `executeWorkflowTrigger`, `errorTrigger`, ...).
/// - **Chains**: simplified types of AI chain and agent nodes.
/// - **Models**: simplified type prefixes of language model sub-nodes. Models are wired
///   *into* a chain through an `ai_languageModel` connection, so they have no incoming
///   edge and would otherwise look unreachable.
///
/// @param triggerKeywords substrings of a node type marking a trigger
/// @param chainTypes simplified types of chain and agent nodes
/// @param modelTypePrefixes simplified type prefixes of language model nodes
public record ReachabilityPolicy(
        List<String> triggerKeywords, List<String> chainTypes, List<String> modelTypePrefixes) {

    private static final ReachabilityPolicy DEFAULTS =
            new ReachabilityPolicy(
                    List.of("Trigger", "webhook"),
                    List.of("chainLlm", "agentExecutor", "chainRetrievalQa", "agent"),
                    List.of("lmChat"));

    public ReachabilityPolicy {
        triggerKeywords = List.copyOf(Objects.requireNonNull(triggerKeywords));
        chainTypes = List.copyOf(Objects.requireNonNull(chainTypes));
        modelTypePrefixes = List.copyOf(Objects.requireNonNull(modelTypePrefixes));
    }

    public static ReachabilityPolicy defaults() {
        return DEFAULTS;
    }

    public boolean isTrigger(Node node) {
        String type = node.getType();
        return type != null && triggerKeywords.stream().anyMatch(type::contains);
    }

    public boolean isChain(Node node) {
        return chainTypes.contains(node.getSimpleType());
    }

    public boolean isModel(Node node) {
        String simpleType = node.getSimpleType();
        return modelTypePrefixes.stream().anyMatch(simpleType::startsWith);
    }
}
