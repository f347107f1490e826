package io.kairon.core.rule;

import java.util.List;
import java.util.Objects;

/// Exempts nodes from a rule by name prefix.
///
/// Nodes that run before the context object exists (`Parse Message`, `Prepare Input`,
/// ...) legitimately read flat input. The exemption is by name only, so a raw-input node
/// named differently is still flagged.
public final class NamePrefixExemption {

    public static final List<String> DEFAULT_PREFIXES =
            List.of("Parse", "Prepare", "Determine", "Check");

    private final List<String> prefixes;

    public NamePrefixExemption(List<String> prefixes) {
        this.prefixes = List.copyOf(Objects.requireNonNull(prefixes, "prefixes must not be null"));
    }

    public static NamePrefixExemption defaults() {
        return new NamePrefixExemption(DEFAULT_PREFIXES);
    }

    public boolean isExempt(String nodeName) {
        return nodeName != null && prefixes.stream().anyMatch(nodeName::startsWith);
    }

    public List<String> getPrefixes() {
        return prefixes;
    }

    @Override
    public String toString() {
        return "NamePrefixExemption" + prefixes;
    }
}
