package com.pipeforge.compiler.graph;

import com.pipeforge.compiler.model.Edge;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.model.PipelineGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Validates a pipeline graph and builds its adjacency view.
 *
 * <p>Rejected with a {@link PipelineConfigurationException}:
 * <ol>
 *   <li>a node with a blank or duplicate id, or without a role;</li>
 *   <li>a FLOW node whose step kind cannot be resolved;</li>
 *   <li>an edge whose source or target is not a declared node.</li>
 * </ol>
 */
@Component
public class GraphAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(GraphAnalyzer.class);

    public GraphAnalysis analyze(PipelineGraph graph) {
        log.debug("Analyzing graph '{}' ({} nodes, {} edges)",
                graph.name(), graph.nodes().size(), graph.edges().size());

        Map<String, Node> nodesById = new LinkedHashMap<>();
        for (Node node : graph.nodes()) {
            if (node.id() == null || node.id().isBlank()) {
                throw new PipelineConfigurationException(String.valueOf(node.label()), "Node has no id");
            }
            if (nodesById.putIfAbsent(node.id(), node) != null) {
                throw new PipelineConfigurationException(node.id(), "Duplicate node id");
            }
            if (node.role() == null) {
                throw new PipelineConfigurationException(node.id(), "Node has no recognised role");
            }
            if (node.role() == NodeRole.FLOW && node.flowKind().isEmpty()) {
                throw new PipelineConfigurationException(node.id(),
                        "Unknown flow step '" + node.typeId() + "'");
            }
        }

        Map<String, List<Edge>> outgoing = new LinkedHashMap<>();
        Map<String, List<Edge>> incoming = new LinkedHashMap<>();
        for (Edge edge : graph.edges()) {
            String edgeId = edge.id() != null ? edge.id() : edge.source() + "->" + edge.target();
            if (edge.source() == null || !nodesById.containsKey(edge.source())) {
                throw new PipelineConfigurationException(edgeId,
                        "Edge source '" + edge.source() + "' is not a node of the graph");
            }
            if (edge.target() == null || !nodesById.containsKey(edge.target())) {
                throw new PipelineConfigurationException(edgeId,
                        "Edge target '" + edge.target() + "' is not a node of the graph");
            }
            outgoing.computeIfAbsent(edge.source(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.target(), k -> new ArrayList<>()).add(edge);
        }
        outgoing.replaceAll((k, v) -> List.copyOf(v));
        incoming.replaceAll((k, v) -> List.copyOf(v));

        List<String> roots  = new ArrayList<>();
        List<String> leaves = new ArrayList<>();
        for (String id : nodesById.keySet()) {
            if (!incoming.containsKey(id)) roots.add(id);
            if (!outgoing.containsKey(id)) leaves.add(id);
        }

        log.debug("Graph '{}': roots={} leaves={}", graph.name(), roots, leaves);
        return new GraphAnalysis(graph, nodesById, outgoing, incoming, roots, leaves);
    }
}
