package com.pipeforge.compiler.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete workflow definition: the top-level state machine, or the
 * iterator nested inside a Map state.
 *
 * @param comment        optional human-readable description
 * @param states         state name to state, in emission order
 * @param timeoutSeconds whole-execution timeout, or null for none
 */
public record CompiledWorkflow(
        String                        comment,
        String                        startAt,
        Map<String, WorkflowState>    states,
        Integer                       timeoutSeconds) {

    public CompiledWorkflow {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
    }

    public static CompiledWorkflow of(String startAt, Map<String, WorkflowState> states) {
        return new CompiledWorkflow(null, startAt, states, null);
    }

    /** A workflow consisting of one terminal no-op Pass state. */
    public static CompiledWorkflow noOp(String stateName) {
        return of(stateName, Map.of(stateName, PassState.terminal()));
    }

    public WorkflowState state(String name) {
        return states.get(name);
    }

    public CompiledWorkflow withHeader(String comment, Integer timeoutSeconds) {
        return new CompiledWorkflow(comment, startAt, states, timeoutSeconds);
    }
}
