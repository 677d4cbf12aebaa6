package com.pipeforge.compiler.graph;

import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.FlowKind;
import com.pipeforge.compiler.model.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds the processor chain hanging off each Map node.
 *
 * A chain starts at the target of the Map's "Processor" edge and follows the
 * first outgoing edge of each member until a node has no successor or a node
 * repeats.
 */
@Component
public class ProcessorChainFinder {

    private static final Logger log = LoggerFactory.getLogger(ProcessorChainFinder.class);

    public Map<String, List<String>> findChains(GraphAnalysis analysis) {
        Map<String, List<String>> chains = new LinkedHashMap<>();
        for (Node node : analysis.nodes()) {
            if (!node.isFlow(FlowKind.MAP)) continue;
            analysis.outgoing(node.id()).stream()
                    .filter(Edge::isProcessorEdge)
                    .findFirst()
                    .ifPresent(edge -> {
                        List<String> chain = follow(analysis, edge.target());
                        chains.put(node.id(), chain);
                        log.debug("Processor chain for map '{}': {}", node.id(), chain);
                    });
        }
        return chains;
    }

    private List<String> follow(GraphAnalysis analysis, String startId) {
        Set<String> chain = new LinkedHashSet<>();
        String current = startId;
        while (current != null && chain.add(current)) {
            List<Edge> out = analysis.outgoing(current);
            current = out.isEmpty() ? null : out.get(0).target();
        }
        return new ArrayList<>(chain);
    }
}
