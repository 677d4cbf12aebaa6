package com.pipeforge.compiler.workflow;

/**
 * A Choice branch whose target state is not known yet.
 *
 * The synthesizer emits handles scoped to the Choice node; the linker
 * replaces each one with a concrete state name by inspecting the node's
 * outgoing edges.
 */
public record BranchHandle(String nodeId, Branch branch) {

    public enum Branch { TRUE, DEFAULT, FAIL }

    @Override
    public String toString() {
        return nodeId + ":" + branch;
    }
}
