package com.pipeforge.compiler.service;

import com.pipeforge.compiler.compile.CompileWarning;
import com.pipeforge.compiler.compile.HandleResolver;
import com.pipeforge.compiler.compile.WorkflowCompiler;
import com.pipeforge.compiler.model.Node;
import com.pipeforge.compiler.model.NodeRole;
import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.model.PipelineGraph;
import com.pipeforge.compiler.trigger.PatternTemplateSource;
import com.pipeforge.compiler.trigger.TriggerPatternCompiler;
import com.pipeforge.compiler.trigger.TriggerRule;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles a whole pipeline: the workflow definition plus one event rule per
 * trigger node.
 *
 * Every call is timed and counted:
 * <pre>
 *   pipeline.compile.calls{status="success|config_error|error"}
 *   pipeline.compile.duration{status=...}
 * </pre>
 */
@Service
public class PipelineCompilerService {

    private static final Logger log = LoggerFactory.getLogger(PipelineCompilerService.class);

    private final WorkflowCompiler       workflowCompiler;
    private final TriggerPatternCompiler triggerCompiler;
    private final PatternTemplateSource  templates;
    private final MeterRegistry          meterRegistry;

    public PipelineCompilerService(WorkflowCompiler workflowCompiler,
                                   TriggerPatternCompiler triggerCompiler,
                                   PatternTemplateSource templates,
                                   MeterRegistry meterRegistry) {
        this.workflowCompiler = workflowCompiler;
        this.triggerCompiler  = triggerCompiler;
        this.templates        = templates;
        this.meterRegistry    = meterRegistry;
    }

    /**
     * @throws PipelineConfigurationException if the graph is structurally unusable
     */
    public CompilationResult compile(PipelineGraph graph, HandleResolver handles) {
        // Every log line of this compile carries the pipeline name.
        MDC.put("pipeline", graph.name());
        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        try {
            List<CompileWarning> warnings = new ArrayList<>();
            CompiledWorkflow workflow = workflowCompiler.compile(graph, handles, warnings);

            List<TriggerRule> triggers = new ArrayList<>();
            for (Node node : graph.nodes()) {
                if (node.role() != NodeRole.TRIGGER) continue;
                triggerCompiler.compileTrigger(node, graph.name(), templates, warnings::add)
                        .ifPresent(triggers::add);
            }

            log.info("Pipeline '{}' compiled: {} states, {} trigger rule(s), {} warning(s)",
                    graph.name(), workflow.states().size(), triggers.size(), warnings.size());
            return new CompilationResult(workflow, triggers, warnings);
        } catch (PipelineConfigurationException e) {
            status = "config_error";
            log.warn("Pipeline '{}' rejected: {}", graph.name(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            status = "error";
            log.error("Unexpected failure compiling pipeline '{}'", graph.name(), e);
            throw e;
        } finally {
            sample.stop(meterRegistry.timer("pipeline.compile.duration", "status", status));
            meterRegistry.counter("pipeline.compile.calls", "status", status).increment();
            MDC.remove("pipeline");
        }
    }
}
