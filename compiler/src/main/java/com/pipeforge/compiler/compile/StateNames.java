package com.pipeforge.compiler.compile;

import com.pipeforge.compiler.model.Node;

/**
 * Derives workflow state names from nodes.
 *
 * Names keep only letters, digits, '_' and '-'. Node-derived names end with
 * the node id so two nodes with the same label never collide.
 */
public final class StateNames {

    /** Engine limit for a state name. */
    public static final int MAX_LENGTH = 80;

    // Room left for the "_StandardMap" suffix of dual-source Map states.
    private static final int MAX_BASE_LENGTH = MAX_LENGTH - 16;

    private StateNames() {}

    public static String forNode(Node node) {
        Object operationId = node.config("operationId");
        String base = sanitize(node.displayName()
                + (operationId == null ? "" : " " + operationId));
        String suffix = "_" + sanitize(node.id());
        int room = MAX_BASE_LENGTH - suffix.length();
        if (room <= 0) {
            return truncate(suffix.substring(1), MAX_BASE_LENGTH);
        }
        return trimUnderscores(truncate(base, room)) + suffix;
    }

    public static String forProcessor(int index, Node node) {
        return truncate("Processor_" + index + "_" + sanitize(node.displayName()), MAX_LENGTH);
    }

    public static String sanitize(String raw) {
        if (raw == null) return "";
        String cleaned = raw.replaceAll("[^A-Za-z0-9_-]", "_").replaceAll("_+", "_");
        return trimUnderscores(cleaned);
    }

    private static String trimUnderscores(String s) {
        return s.replaceAll("^_+", "").replaceAll("_+$", "");
    }

    private static String truncate(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }
}
