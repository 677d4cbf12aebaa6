package com.pipeforge.compiler.workflow;

public record FailState(String error, String cause) implements WorkflowState {

    @Override public String type() { return "Fail"; }

    @Override public boolean isTerminalKind() { return true; }
}
