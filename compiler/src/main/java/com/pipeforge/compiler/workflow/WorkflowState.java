package com.pipeforge.compiler.workflow;

/**
 * One state of a compiled workflow definition.
 *
 * The hierarchy is closed: {@link ChainingState}s (Task, Pass, Wait, Parallel,
 * Map) carry an optional successor, {@link ChoiceState} branches, and
 * {@link SucceedState} / {@link FailState} always end the execution.
 */
public sealed interface WorkflowState permits ChainingState, ChoiceState, SucceedState, FailState {

    /** The engine's "Type" value. */
    String type();

    /** Succeed and Fail states never transition, whatever the graph says. */
    default boolean isTerminalKind() {
        return false;
    }
}
