package com.pipeforge.compiler.model;

/**
 * A directed connection between two nodes.
 *
 * @param sourceHandle the output port the edge leaves from, e.g. "Completed",
 *                     "In Progress" or "Fail" on a Choice node, or "Processor"
 *                     on a Map node. Null for ordinary single-output nodes.
 */
public record Edge(String id, String source, String target, String sourceHandle) {

    public static final String PROCESSOR_HANDLE = "Processor";

    public Edge(String id, String source, String target) {
        this(id, source, target, null);
    }

    public boolean isProcessorEdge() {
        return PROCESSOR_HANDLE.equals(sourceHandle);
    }

    public boolean hasHandle() {
        return sourceHandle != null && !sourceHandle.isBlank();
    }
}
