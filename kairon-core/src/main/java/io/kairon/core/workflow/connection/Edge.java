package io.kairon.core.workflow.connection;

import java.util.LinkedHashMap;
import java.util.Map;

/// Target entry of an output slot: `{node, type, index}`.
///
/// @param node target node name, may be null for malformed entries
/// @param type input connection type on the target, e.g. `main`
/// @param index input index on the target
public record Edge(String node, String type, int index) {

    public static Edge main(String node) {
        return new Edge(node, Connections.MAIN, 0);
    }

    /// Returns the JSON object form of this edge.
    ///
    /// @return mutable map with `node`, `type` and `index`, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("node", node);
        map.put("type", type);
        map.put("index", index);
        return map;
    }
}
