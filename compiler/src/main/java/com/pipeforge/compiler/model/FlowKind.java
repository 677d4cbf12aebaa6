package com.pipeforge.compiler.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The closed set of control-flow steps a FLOW node can compile to.
 */
public enum FlowKind {
    WAIT,
    CHOICE,
    PARALLEL,
    MAP,
    PASS,
    SUCCEED,
    FAIL;

    public static Optional<FlowKind> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        String key = name.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case "wait"              -> Optional.of(WAIT);
            case "choice"            -> Optional.of(CHOICE);
            case "parallel"          -> Optional.of(PARALLEL);
            case "map"               -> Optional.of(MAP);
            case "pass"              -> Optional.of(PASS);
            case "succeed", "success" -> Optional.of(SUCCEED);
            case "fail", "failure"   -> Optional.of(FAIL);
            default                  -> Optional.empty();
        };
    }
}
