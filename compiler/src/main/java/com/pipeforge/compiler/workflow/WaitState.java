package com.pipeforge.compiler.workflow;

public record WaitState(int seconds, String next) implements ChainingState {

    @Override public String type() { return "Wait"; }

    @Override
    public WaitState withNext(String next) {
        return new WaitState(seconds, next);
    }
}
