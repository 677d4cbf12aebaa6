package com.pipeforge.compiler.workflow;

public record SucceedState() implements WorkflowState {

    @Override public String type() { return "Succeed"; }

    @Override public boolean isTerminalKind() { return true; }
}
