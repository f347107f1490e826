package io.kairon.core;

import io.kairon.core.graph.ReachabilityPolicy;
import io.kairon.core.rule.NamePrefixExemption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Configuration options of the workflow linter.
///
/// Carries the project conventions the rules check against. Use the {@link Builder} for
/// fluent configuration or construct directly with setters.
///
/// ### Default Values
/// - `preContextPrefixes`: `Parse`, `Prepare`, `Determine`, `Check`
/// - `approvedNamespaces`: `event`, `llm`, `db`, `validation`, `thread`, `command`,
///   `projection`, `timing`
/// - `toleratedNamespaces`: `response`, `error`, `result`, `data`
/// - `databaseWorkflow`: `"Query_DB"`
/// - `disabledRules`: none
/// - `reachabilityPolicy`: {@link ReachabilityPolicy#defaults()}
///
/// @implNote **Not thread-safe**. Configure before passing to {@link WorkflowLinter};
/// do not modify afterwards.
///
/// @see WorkflowLinter#WorkflowLinter(LinterConfig)
public class LinterConfig {

    public static final List<String> DEFAULT_APPROVED_NAMESPACES =
            List.of("event", "llm", "db", "validation", "thread", "command", "projection", "timing");
    public static final List<String> DEFAULT_TOLERATED_NAMESPACES =
            List.of("response", "error", "result", "data");
    public static final String DEFAULT_DATABASE_WORKFLOW = "Query_DB";

    private List<String> preContextPrefixes = NamePrefixExemption.DEFAULT_PREFIXES;
    private List<String> approvedNamespaces = DEFAULT_APPROVED_NAMESPACES;
    private List<String> toleratedNamespaces = DEFAULT_TOLERATED_NAMESPACES;
    private String databaseWorkflow = DEFAULT_DATABASE_WORKFLOW;
    private Set<String> disabledRules = new LinkedHashSet<>();
    private ReachabilityPolicy reachabilityPolicy = ReachabilityPolicy.defaults();

    /// Creates a configuration with default values.
    public LinterConfig() {}

    public static LinterConfig defaults() {
        return new LinterConfig();
    }

    /// Returns the node-name prefixes exempt from the ctx convention.
    ///
    /// @return prefixes, never null
    public List<String> getPreContextPrefixes() {
        return preContextPrefixes;
    }

    public void setPreContextPrefixes(List<String> preContextPrefixes) {
        this.preContextPrefixes = List.copyOf(preContextPrefixes);
    }

    public List<String> getApprovedNamespaces() {
        return approvedNamespaces;
    }

    public void setApprovedNamespaces(List<String> approvedNamespaces) {
        this.approvedNamespaces = List.copyOf(approvedNamespaces);
    }

    public List<String> getToleratedNamespaces() {
        return toleratedNamespaces;
    }

    public void setToleratedNamespaces(List<String> toleratedNamespaces) {
        this.toleratedNamespaces = List.copyOf(toleratedNamespaces);
    }

    /// Returns the name of the wrapper workflow allowed to use Postgres directly.
    ///
    /// @return workflow name, never null
    public String getDatabaseWorkflow() {
        return databaseWorkflow;
    }

    public void setDatabaseWorkflow(String databaseWorkflow) {
        this.databaseWorkflow = databaseWorkflow;
    }

    /// Returns ids of rules that are not evaluated.
    ///
    /// @return mutable set of rule ids, never null
    public Set<String> getDisabledRules() {
        return disabledRules;
    }

    public void setDisabledRules(Set<String> disabledRules) {
        this.disabledRules = new LinkedHashSet<>(disabledRules);
    }

    public boolean isRuleEnabled(String ruleId) {
        return !disabledRules.contains(ruleId);
    }

    public ReachabilityPolicy getReachabilityPolicy() {
        return reachabilityPolicy;
    }

    public void setReachabilityPolicy(ReachabilityPolicy reachabilityPolicy) {
        this.reachabilityPolicy = reachabilityPolicy;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link LinterConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final LinterConfig config = new LinterConfig();

        private Builder() {}

        public Builder preContextPrefixes(List<String> prefixes) {
            config.setPreContextPrefixes(prefixes);
            return this;
        }

        public Builder approvedNamespaces(List<String> namespaces) {
            config.setApprovedNamespaces(namespaces);
            return this;
        }

        public Builder toleratedNamespaces(List<String> namespaces) {
            config.setToleratedNamespaces(namespaces);
            return this;
        }

        public Builder databaseWorkflow(String databaseWorkflow) {
            config.setDatabaseWorkflow(databaseWorkflow);
            return this;
        }

        /// Disables rules by id; unknown ids are ignored.
        ///
        /// @param ruleIds rule ids, not null
        /// @return this builder for chaining, never null
        public Builder disableRules(Set<String> ruleIds) {
            config.disabledRules.addAll(ruleIds);
            return this;
        }

        public Builder disableRule(String ruleId) {
            config.disabledRules.add(ruleId);
            return this;
        }

        public Builder reachabilityPolicy(ReachabilityPolicy policy) {
            config.setReachabilityPolicy(policy);
            return this;
        }

        public LinterConfig build() {
            return config;
        }
    }
}
