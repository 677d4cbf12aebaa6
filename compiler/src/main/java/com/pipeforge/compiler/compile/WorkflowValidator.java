package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.model.PipelineConfigurationException;
import com.pipeforge.compiler.workflow.BranchTarget;
import com.pipeforge.compiler.workflow.ChainingState;
import com.pipeforge.compiler.workflow.ChoiceState;
import com.pipeforge.compiler.workflow.CompiledWorkflow;
import com.pipeforge.compiler.workflow.MapState;
import com.pipeforge.compiler.workflow.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Final structural check of a compiled workflow, including every Map
 * iterator nested inside it.
 *
 * Unreachable states are reported in the log but kept.
 */
@Component
public class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    public void validate(CompiledWorkflow workflow) {
        validate(workflow, "workflow");
    }

    private void validate(CompiledWorkflow workflow, String scope) {
        Map<String, WorkflowState> states = workflow.states();
        if (states.isEmpty()) {
            throw new PipelineConfigurationException(scope, "Workflow has no states");
        }
        if (workflow.startAt() == null || !states.containsKey(workflow.startAt())) {
            throw new PipelineConfigurationException(scope,
                    "StartAt '" + workflow.startAt() + "' is not a state of the workflow");
        }

        boolean hasTerminal = false;
        for (Map.Entry<String, WorkflowState> entry : states.entrySet()) {
            String name = entry.getKey();
            WorkflowState state = entry.getValue();

            if (state.isTerminalKind()) {
                hasTerminal = true;
            } else if (state instanceof ChainingState chaining) {
                if (chaining.isEnd()) {
                    hasTerminal = true;
                } else {
                    requireState(states, chaining.next(), name);
                }
            } else if (state instanceof ChoiceState choice) {
                for (BranchTarget target : choice.targets()) {
                    if (!(target instanceof BranchTarget.State resolved)) {
                        throw new PipelineConfigurationException(name,
                                "Choice branch " + target + " was never linked");
                    }
                    requireState(states, resolved.name(), name);
                }
            }

            if (state instanceof MapState map) {
                if (map.iterator() == null) {
                    throw new PipelineConfigurationException(name, "Map state has no iterator");
                }
                validate(map.iterator(), name);
            }
        }
        if (!hasTerminal) {
            throw new PipelineConfigurationException(scope, "Workflow has no terminal state");
        }

        Set<String> reachable = reachableFrom(workflow.startAt(), states);
        for (String name : states.keySet()) {
            if (!reachable.contains(name)) {
                log.warn("State '{}' in {} is not reachable from '{}'", name, scope, workflow.startAt());
            }
        }
    }

    private static void requireState(Map<String, WorkflowState> states, String target, String from) {
        if (!states.containsKey(target)) {
            throw new PipelineConfigurationException(from,
                    "State '" + from + "' transitions to unknown state '" + target + "'");
        }
    }

    private static Set<String> reachableFrom(String startAt, Map<String, WorkflowState> states) {
        Set<String> seen = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>(List.of(startAt));
        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!seen.add(name)) continue;
            queue.addAll(GraphLinker.successors(states.get(name)));
        }
        return seen;
    }
}
