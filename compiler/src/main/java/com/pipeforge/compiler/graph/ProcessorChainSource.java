package com.pipeforge.compiler.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the ordered node ids that make up a Map node's processor chain.
 */
@FunctionalInterface
public interface ProcessorChainSource {

    Optional<List<String>> chainOf(String mapNodeId);

    static ProcessorChainSource fromMap(Map<String, List<String>> chains) {
        return mapNodeId -> Optional.ofNullable(chains.get(mapNodeId));
    }
}
