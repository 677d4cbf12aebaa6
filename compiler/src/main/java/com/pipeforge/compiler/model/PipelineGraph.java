package com.pipeforge.compiler.model;

import java.util.List;

/**
 * The full user-authored pipeline: nodes, edges and pipeline-level settings.
 * Read-only input to one compile.
 */
public record PipelineGraph(
        String           name,
        List<Node>       nodes,
        List<Edge>       edges,
        PipelineSettings settings) {

    public PipelineGraph {
        if (name == null || name.isBlank()) name = "pipeline";
        nodes    = nodes == null ? List.of() : List.copyOf(nodes);
        edges    = edges == null ? List.of() : List.copyOf(edges);
        settings = settings == null ? PipelineSettings.defaults() : settings;
    }
}
