package com.pipeforge.compiler.compile;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the deployed compute handle (function ARN or equivalent) for an
 * invocable node.
 */
@FunctionalInterface
public interface HandleResolver {

    Optional<String> handleOf(String nodeId);

    static HandleResolver fromMap(Map<String, String> handles) {
        Map<String, String> table = handles == null ? Map.of() : new HashMap<>(handles);
        return nodeId -> Optional.ofNullable(table.get(nodeId)).filter(h -> !h.isBlank());
    }

    static HandleResolver none() {
        return nodeId -> Optional.empty();
    }
}
