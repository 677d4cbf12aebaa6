package com.pipeforge.compiler.model;

/**
 * Thrown when the pipeline graph is structurally unusable: dangling edge
 * references, duplicate ids, multiple entry points, cycles, or a Choice
 * branch that no edge resolves.
 *
 * Always fatal for the compile. Carries the id of the offending node, edge
 * or state so the editor can highlight it.
 */
public class PipelineConfigurationException extends RuntimeException {

    private final String elementId;

    public PipelineConfigurationException(String elementId, String message) {
        super("[" + elementId + "] " + message);
        this.elementId = elementId;
    }

    public String getElementId() { return elementId; }
}
