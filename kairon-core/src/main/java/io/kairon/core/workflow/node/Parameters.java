package io.kairon.core.workflow.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Schema-less parameter bag of a node with typed, path-based accessors.
///
/// Node parameters are arbitrary JSON objects whose shape depends on the node type and
/// version. Rules never fail on unexpected shapes: every accessor returns an empty or null
/// value when a key is absent or holds a value of a different JSON type, which rules treat
/// as "not applicable".
///
/// Paths are dot-separated keys into nested objects, e.g. `options.fallbackOutput` or
/// `conditions.conditions`.
///
/// @implNote Immutable view. The wrapped map is never modified.
public final class Parameters {

    private static final Parameters EMPTY = new Parameters(Map.of());

    private final Map<String, Object> values;

    private Parameters(Map<String, Object> values) {
        this.values = values;
    }

    /// Wraps a raw parameter map.
    ///
    /// @param values raw JSON object, may be null (treated as empty)
    /// @return parameter view, never null
    public static Parameters of(Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new Parameters(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static Parameters empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /// Checks whether a value, possibly JSON null, is present at the path.
    ///
    /// @param path dot-separated key path, not null
    /// @return true if the last key exists in its parent object
    public boolean has(String path) {
        int lastDot = path.lastIndexOf('.');
        Map<String, Object> parent =
                lastDot < 0 ? values : asMap(get(path.substring(0, lastDot)));
        return parent.containsKey(path.substring(lastDot + 1));
    }

    /// Resolves the raw value at a path.
    ///
    /// @param path dot-separated key path, not null
    /// @return the value, or null if any segment is absent or not an object
    public Object get(String path) {
        Object current = values;
        for (String key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }

    /// @return the string at the path, or null if absent or not a string
    public String getString(String path) {
        return get(path) instanceof String s ? s : null;
    }

    /// @return the string at the path, or an empty string if absent or not a string
    public String getStringOrEmpty(String path) {
        String value = getString(path);
        return value != null ? value : "";
    }

    /// @return the object at the path, or an empty map if absent or not an object
    public Map<String, Object> getMap(String path) {
        return asMap(get(path));
    }

    /// @return the array at the path, or an empty list if absent or not an array
    public List<Object> getList(String path) {
        Object value = get(path);
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<Object>(list));
        }
        return List.of();
    }

    /// @return the boolean at the path, or the default if absent or not a boolean
    public boolean getBoolean(String path, boolean defaultValue) {
        return get(path) instanceof Boolean b ? b : defaultValue;
    }

    /// Returns the raw parameter map.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Object> asMap() {
        return values;
    }

    /// Copies an arbitrary JSON value into an object view.
    ///
    /// @param value any parsed JSON value, may be null
    /// @return unmodifiable map, or an empty map if the value is not an object
    public static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, entry) -> copy.put(String.valueOf(key), entry));
            return Collections.unmodifiableMap(copy);
        }
        return Map.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Parameters that)) return false;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }
}
