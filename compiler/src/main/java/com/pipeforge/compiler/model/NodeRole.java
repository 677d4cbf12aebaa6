package com.pipeforge.compiler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The four node roles a pipeline author can place on the canvas.
 *
 * TRIGGER nodes never become workflow states; they only produce event-bus
 * rule patterns. COMPUTE and INTEGRATION nodes are both backed by an
 * invocable unit of code and compile to Task states. FLOW nodes compile to
 * control-flow states according to their {@link FlowKind}.
 */
public enum NodeRole {
    TRIGGER,
    COMPUTE,
    FLOW,
    INTEGRATION;

    /** True for roles that are backed by a compute handle. */
    public boolean isInvocable() {
        return this == COMPUTE || this == INTEGRATION;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of the role string sent by the editor.
     *
     * Returns null for anything unrecognised; the graph analyzer reports that
     * as a configuration error naming the node.
     */
    @JsonCreator
    public static NodeRole fromWireName(String value) {
        if (value == null) return null;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "trigger"                        -> TRIGGER;
            case "compute", "utility", "lambda"   -> COMPUTE;
            case "flow", "flow-control", "flow_control" -> FLOW;
            case "integration"                    -> INTEGRATION;
            default                               -> null;
        };
    }
}
