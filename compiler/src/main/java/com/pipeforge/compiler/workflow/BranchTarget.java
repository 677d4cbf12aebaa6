package com.pipeforge.compiler.workflow;

/**
 * Where a Choice rule (or the Choice default) transitions to: either a
 * resolved state name or a {@link BranchHandle} still awaiting the linker.
 */
public sealed interface BranchTarget {

    record State(String name) implements BranchTarget {}

    record Pending(BranchHandle handle) implements BranchTarget {}

    static BranchTarget state(String name) {
        return new State(name);
    }

    static BranchTarget pending(String nodeId, BranchHandle.Branch branch) {
        return new Pending(new BranchHandle(nodeId, branch));
    }
}
