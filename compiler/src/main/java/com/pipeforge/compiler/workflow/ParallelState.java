package com.pipeforge.compiler.workflow;

import java.util.List;

/**
 * Runs the configured branches concurrently. Branch definitions are authored
 * directly in engine syntax and passed through untouched.
 */
public record ParallelState(List<Object> branches, String next) implements ChainingState {

    public ParallelState {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    @Override public String type() { return "Parallel"; }

    @Override
    public ParallelState withNext(String next) {
        return new ParallelState(branches, next);
    }
}
