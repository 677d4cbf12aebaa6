package com.pipeforge.compiler.workflow;

/**
 * A state with at most one successor. A null {@link #next()} means the state
 * ends the execution ("End": true).
 */
public sealed interface ChainingState extends WorkflowState
        permits TaskState, PassState, WaitState, ParallelState, MapState {

    String next();

    ChainingState withNext(String next);

    default boolean isEnd() {
        return next() == null;
    }
}
