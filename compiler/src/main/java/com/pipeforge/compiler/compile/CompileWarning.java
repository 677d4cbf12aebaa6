package com.pipeforge.compiler.compile;

/**
 * A non-fatal problem found while compiling. The compile still produces a
 * deployable result; the warning is surfaced to the author.
 *
 * @param elementId id of the node (or rule) the warning is about
 */
public record CompileWarning(Kind kind, String elementId, String message) {

    public enum Kind {
        /** A compute node has no deployed handle; a diagnostic Pass state stands in. */
        MISSING_HANDLE,
        /** A node parameter could not be interpreted; a default was used. */
        INVALID_PARAMETER,
        /** A trigger pattern template could not be applied; the built-in pattern was used. */
        TEMPLATE_PROCESSING
    }

    @Override
    public String toString() {
        return kind + " [" + elementId + "] " + message;
    }
}
