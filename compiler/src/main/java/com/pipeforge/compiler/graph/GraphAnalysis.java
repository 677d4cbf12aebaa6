package com.pipeforge.compiler.graph;

import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of a validated pipeline graph with adjacency in
 * declaration order. Produced by {@link GraphAnalyzer}.
 */
public final class GraphAnalysis {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalysis.class);

    private final PipelineGraph           graph;
    private final Map<String, Node>       nodesById;
    private final Map<String, List<Edge>> outgoing;
    private final Map<String, List<Edge>> incoming;
    private final List<String>            rootNodeIds;
    private final List<String>            leafNodeIds;

    GraphAnalysis(PipelineGraph graph,
                  Map<String, Node> nodesById,
                  Map<String, List<Edge>> outgoing,
                  Map<String, List<Edge>> incoming,
                  List<String> rootNodeIds,
                  List<String> leafNodeIds) {
        this.graph       = graph;
        this.nodesById   = nodesById;
        this.outgoing    = outgoing;
        this.incoming    = incoming;
        this.rootNodeIds = List.copyOf(rootNodeIds);
        this.leafNodeIds = List.copyOf(leafNodeIds);
    }

    public PipelineGraph graph()          { return graph; }
    public Collection<Node> nodes()       { return nodesById.values(); }
    public List<Edge> edges()             { return graph.edges(); }
    public List<String> rootNodeIds()     { return rootNodeIds; }
    public List<String> leafNodeIds()     { return leafNodeIds; }

    public Node node(String id) {
        return nodesById.get(id);
    }

    public boolean contains(String id) {
        return nodesById.containsKey(id);
    }

    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public List<Edge> incoming(String nodeId) {
        return incoming.getOrDefault(nodeId, List.of());
    }

    // ------------------------------------------------------------------
    // First / last compute node
    // ------------------------------------------------------------------

    /**
     * Walks the default path and returns the first and last invocable nodes
     * on it.
     *
     * The walk starts at the first trigger node (or the first root, or the
     * first node) and follows the first non-Processor outgoing edge of each
     * node. Flow nodes are stepped over but never counted.
     */
    public ComputeEndpoints findFirstAndLastCompute() {
        List<Node> invocable = nodes().stream().filter(n -> n.role().isInvocable()).toList();
        if (invocable.isEmpty()) {
            return ComputeEndpoints.NONE;
        }

        String first = null;
        String last  = null;
        Set<String> visited = new HashSet<>();
        String current = walkStart().orElse(null);
        while (current != null && visited.add(current)) {
            Node node = nodesById.get(current);
            if (node.role().isInvocable()) {
                if (first == null) first = current;
                last = current;
            }
            current = defaultSuccessor(current).orElse(null);
        }

        if (first == null) {
            String fallback = invocable.get(0).id();
            log.warn("No compute node on the default path of '{}'; using '{}' as first and last",
                    graph.name(), fallback);
            return new ComputeEndpoints(fallback, fallback);
        }
        log.debug("First compute node: {}, last compute node: {}", first, last);
        return new ComputeEndpoints(first, last);
    }

    private Optional<String> walkStart() {
        Optional<String> trigger = nodes().stream()
                .filter(n -> n.role() == NodeRole.TRIGGER)
                .map(Node::id)
                .findFirst();
        if (trigger.isPresent()) return trigger;
        if (!rootNodeIds.isEmpty()) return Optional.of(rootNodeIds.get(0));
        return nodes().stream().map(Node::id).findFirst();
    }

    private Optional<String> defaultSuccessor(String nodeId) {
        List<Edge> out = outgoing(nodeId);
        return out.stream()
                .filter(e -> !e.isProcessorEdge())
                .findFirst()
                .or(() -> out.stream().findFirst())
                .map(Edge::target);
    }

    /**
     * The first and last invocable nodes of the default path. Both ids are
     * null when the graph has no invocable node at all.
     */
    public record ComputeEndpoints(String firstId, String lastId) {

        public static final ComputeEndpoints NONE = new ComputeEndpoints(null, null);

        public boolean isPresent() {
            return firstId != null;
        }
    }
}
