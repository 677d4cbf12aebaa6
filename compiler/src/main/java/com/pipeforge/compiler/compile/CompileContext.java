package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.graph.GraphAnalysis;
import com.pipeforge.compiler.graph.ProcessorChainSource;
import com.pipeforge.compiler.model.PipelineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Everything one compile needs besides the node being synthesized.
 *
 * {@link #source()} is always the analysis of the whole authored graph, also
 * while a Map iterator is being built from a restricted sub-graph. Warnings
 * are collected into a list owned by the caller.
 */
public final class CompileContext {

    private static final Logger log = LoggerFactory.getLogger(CompileContext.class);

    private final GraphAnalysis        source;
    private final HandleResolver       handles;
    private final ProcessorChainSource chains;
    private final String               firstComputeId;
    private final List<CompileWarning> warnings;

    public CompileContext(GraphAnalysis source,
                          HandleResolver handles,
                          ProcessorChainSource chains,
                          String firstComputeId,
                          List<CompileWarning> warnings) {
        this.source         = source;
        this.handles        = handles;
        this.chains         = chains;
        this.firstComputeId = firstComputeId;
        this.warnings       = warnings;
    }

    public GraphAnalysis source()            { return source; }
    public PipelineSettings settings()       { return source.graph().settings(); }
    public List<CompileWarning> warnings()   { return warnings; }

    public Optional<String> handleOf(String nodeId) {
        return handles.handleOf(nodeId);
    }

    public Optional<List<String>> chainOf(String mapNodeId) {
        return chains.chainOf(mapNodeId);
    }

    public boolean isFirstCompute(String nodeId) {
        return firstComputeId != null && firstComputeId.equals(nodeId);
    }

    /** Context for a Map iterator: same collaborators, no first compute node. */
    public CompileContext forChain() {
        return new CompileContext(source, handles, chains, null, warnings);
    }

    public void warn(CompileWarning.Kind kind, String elementId, String message) {
        CompileWarning warning = new CompileWarning(kind, elementId, message);
        log.warn("Pipeline '{}': {}", source.graph().name(), warning);
        warnings.add(warning);
    }
}
