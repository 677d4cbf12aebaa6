package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.workflow.ChainingState;
import com.pipeforge.compiler.workflow.WorkflowState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The states one node compiles to.
 *
 * @param primary name of the state that incoming edges point at
 * @param states  every state the node emits, primary first
 * @param exits   names of the states that take the node's outgoing
 *                transition; empty for Choice, Succeed and Fail
 */
public record NodeStates(String primary, Map<String, WorkflowState> states, List<String> exits) {

    public NodeStates {
        states = Collections.unmodifiableMap(new LinkedHashMap<>(states));
        exits  = List.copyOf(exits);
    }

    /** A node that compiles to one state which is also its own exit. */
    public static NodeStates single(String name, WorkflowState state) {
        List<String> exits = state instanceof ChainingState
                ? List.of(name) : List.of();
        return new NodeStates(name, Map.of(name, state), exits);
    }

    public WorkflowState primaryState() {
        return states.get(primary);
    }
}
