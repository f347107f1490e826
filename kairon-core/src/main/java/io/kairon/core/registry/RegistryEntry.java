package io.kairon.core.registry;

import java.util.Objects;

/// Index entry of one workflow document known to the project.
///
/// @param name workflow name, not null
/// @param id runtime workflow id, may be null
/// @param archived whether the document is archived
public record RegistryEntry(String name, String id, boolean archived) {

    public RegistryEntry {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static RegistryEntry of(String name) {
        return new RegistryEntry(name, null, false);
    }
}
