package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.graph.GraphAnalysis;
import com.pipeforge.compiler.graph.GraphAnalyzer;
import com.pipeforge.compiler.graph.ProcessorChainFinder;
import com.pipeforge.compiler.graph.ProcessorChainSource;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineGraph;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a pipeline graph into a workflow definition.
 *
 * <ol>
 *   <li>Analyze and validate the graph.</li>
 *   <li>Find the processor chain of every Map node in this graph.</li>
 *   <li>Name one state per node.</li>
 *   <li>Locate the first compute node on the default path.</li>
 *   <li>Synthesize and link the states.</li>
 *   <li>Validate the result and attach the pipeline-level header.</li>
 * </ol>
 * A graph without any compute node compiles to a single no-op Pass state.
 */
@Component
public class WorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCompiler.class);

    private final GraphAnalyzer        analyzer;
    private final ProcessorChainFinder chainFinder;
    private final StateSynthesizer     synthesizer;
    private final WorkflowValidator    validator;

    public WorkflowCompiler(GraphAnalyzer analyzer,
                            ProcessorChainFinder chainFinder,
                            StateSynthesizer synthesizer,
                            WorkflowValidator validator) {
        this.analyzer    = analyzer;
        this.chainFinder = chainFinder;
        this.synthesizer = synthesizer;
        this.validator   = validator;
    }

    public CompiledWorkflow compile(PipelineGraph graph, HandleResolver handles) {
        return compile(graph, handles, new ArrayList<>());
    }

    /**
     * @param warnings receives every non-fatal problem found along the way
     * @throws com.pipeforge.compiler.model.PipelineConfigurationException if the graph cannot be compiled
     */
    public CompiledWorkflow compile(PipelineGraph graph, HandleResolver handles, List<CompileWarning> warnings) {
        log.info("Compiling workflow for pipeline '{}'", graph.name());
        GraphAnalysis analysis = analyzer.analyze(graph);

        Map<String, List<String>> chains = chainFinder.findChains(analysis);
        // Only chains found in this graph; a Map without a Processor edge has none.
        ProcessorChainSource chainSource = ProcessorChainSource.fromMap(chains);

        CompiledWorkflow workflow;
        GraphAnalysis.ComputeEndpoints endpoints = analysis.findFirstAndLastCompute();
        if (!endpoints.isPresent()) {
            log.info("Pipeline '{}' has no compute steps; compiling a no-op workflow", graph.name());
            workflow = CompiledWorkflow.noOp(StateSynthesizer.NO_OP_STATE);
        } else {
            CompileContext ctx = new CompileContext(analysis, handles, chainSource, endpoints.firstId(), warnings);
            workflow = synthesizer.synthesizeWorkflow(analysis, stateNames(analysis), ctx);
        }

        validator.validate(workflow);
        Integer timeout = graph.settings().hasTimeout() ? graph.settings().timeoutSeconds() : null;
        workflow = workflow.withHeader("State machine for pipeline " + graph.name(), timeout);

        log.info("Compiled pipeline '{}': {} states, {} warnings",
                graph.name(), workflow.states().size(), warnings.size());
        return workflow;
    }

    private static Map<String, String> stateNames(GraphAnalysis analysis) {
        Map<String, String> names = new LinkedHashMap<>();
        Set<String> used = new HashSet<>();
        for (Node node : analysis.nodes()) {
            if (node.role() == NodeRole.TRIGGER) continue;
            String name = StateNames.forNode(node);
            // Only possible after truncation of very long ids.
            for (int i = 2; !used.add(name); i++) {
                name = StateNames.forNode(node) + "_" + i;
            }
            names.put(node.id(), name);
        }
        return names;
    }
}
