package io.kairon.core.registry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Index of every workflow document in a project, used to resolve cross-workflow
/// references.
///
/// The registry is built once per process, before any document is analyzed, and only
/// read afterwards. Names are the lookup key; the same name registered by several files
/// is kept as several entries so that duplicates can be reported.
///
/// @implNote Immutable and safe for concurrent reads.
///
/// @see RegistryEntry
public final class WorkflowRegistry {

    private static final WorkflowRegistry EMPTY = new WorkflowRegistry(List.of());

    private final Map<String, List<RegistryEntry>> byName;
    private final Set<String> ids;

    private WorkflowRegistry(Collection<RegistryEntry> entries) {
        Map<String, List<RegistryEntry>> names = new LinkedHashMap<>();
        Set<String> knownIds = new LinkedHashSet<>();
        for (RegistryEntry entry : entries) {
            names.computeIfAbsent(entry.name(), k -> new ArrayList<>()).add(entry);
            if (entry.id() != null && !entry.id().isBlank()) {
                knownIds.add(entry.id());
            }
        }
        names.replaceAll((name, list) -> List.copyOf(list));
        this.byName = Collections.unmodifiableMap(names);
        this.ids = Collections.unmodifiableSet(knownIds);
    }

    public static WorkflowRegistry empty() {
        return EMPTY;
    }

    /// Creates a registry from entries.
    ///
    /// @param entries registered documents, not null
    /// @return registry, never null
    public static WorkflowRegistry of(Collection<RegistryEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        return entries.isEmpty() ? EMPTY : new WorkflowRegistry(entries);
    }

    /// Creates a registry of non-archived documents known by name only.
    public static WorkflowRegistry ofNames(String... names) {
        List<RegistryEntry> entries = new ArrayList<>();
        for (String name : names) {
            entries.add(RegistryEntry.of(name));
        }
        return of(entries);
    }

    /// Checks whether a workflow with the given name is registered, archived or not.
    ///
    /// @param name workflow name, may be null
    /// @return true if registered
    public boolean exists(String name) {
        return name != null && byName.containsKey(name);
    }

    /// Checks whether every document registered under a name is archived.
    ///
    /// @param name workflow name, may be null
    /// @return true if registered and archived
    public boolean isArchived(String name) {
        List<RegistryEntry> entries = name != null ? byName.get(name) : null;
        return entries != null && entries.stream().allMatch(RegistryEntry::archived);
    }

    /// @return number of documents registered under the name
    public int occurrences(String name) {
        List<RegistryEntry> entries = name != null ? byName.get(name) : null;
        return entries != null ? entries.size() : 0;
    }

    public boolean containsId(String id) {
        return id != null && ids.contains(id);
    }

    /// @return true if at least one registered document declared an id
    public boolean hasIds() {
        return !ids.isEmpty();
    }

    /// @return registered names in registration order, unmodifiable
    public Set<String> names() {
        return byName.keySet();
    }

    /// @return number of registered documents
    public int size() {
        return byName.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        return "WorkflowRegistry{documents=" + size() + "}";
    }
}
