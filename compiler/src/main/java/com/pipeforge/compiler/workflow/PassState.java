package com.pipeforge.compiler.workflow;

/**
 * Passes its input through, optionally replacing it with a static result.
 */
public record PassState(Object result, String next) implements ChainingState {

    public static PassState terminal() {
        return new PassState(null, null);
    }

    @Override public String type() { return "Pass"; }

    @Override
    public PassState withNext(String next) {
        return new PassState(result, next);
    }
}
