package com.pipeforge.compiler.trigger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Helpers for reading the parameters of a trigger node.
 */
public final class TriggerParameters {

    public static final String FORMAT = "Format";
    public static final String IMAGE_TYPE = "Image Type";
    public static final String VIDEO_TYPE = "Video Type";
    public static final String AUDIO_TYPE = "Audio Type";

    /** Fields whose values are file formats and are matched upper-case. */
    public static final List<String> FORMAT_FIELDS = List.of(FORMAT, IMAGE_TYPE, VIDEO_TYPE, AUDIO_TYPE);

    private static final Set<String> FORMAT_FIELD_SET = Set.copyOf(FORMAT_FIELDS);

    private TriggerParameters() {}

    /**
     * Top-level scalar settings of the node, overridden by the entries of its
     * "parameters" object. A "parameters" list of objects is merged entry by
     * entry, in order.
     */
    public static Map<String, Object> flatten(Map<String, Object> configuration) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (configuration == null) return params;

        configuration.forEach((key, value) -> {
            if (!"parameters".equals(key) && !(value instanceof Map<?, ?>)) {
                params.put(key, value);
            }
        });
        Object nested = configuration.get("parameters");
        if (nested instanceof Map<?, ?> map) {
            map.forEach((k, v) -> params.put(String.valueOf(k), v));
        } else if (nested instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> map) {
                    map.forEach((k, v) -> params.put(String.valueOf(k), v));
                }
            }
        }
        return params;
    }

    public static boolean isFormatField(String name) {
        return name != null && FORMAT_FIELD_SET.contains(name);
    }

    /** The first populated format-type parameter, or null. */
    public static String formatValue(Map<String, Object> params) {
        for (String field : FORMAT_FIELDS) {
            Object value = params.get(field);
            if (isPopulated(value)) return value.toString();
        }
        return null;
    }

    public static boolean isPopulated(Object value) {
        if (value == null) return false;
        if (value instanceof String s) return !s.isBlank();
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    /**
     * Normalizes a parameter value into an event-pattern match list.
     *
     * Strings are split on commas, trimmed and stripped of empty items;
     * other scalars become a single-element list.
     */
    public static List<Object> toList(Object raw, boolean upperCase) {
        List<Object> values = new ArrayList<>();
        if (raw == null) return values;
        if (raw instanceof Collection<?> items) {
            for (Object item : items) values.addAll(toList(item, upperCase));
            return values;
        }
        if (raw instanceof String s) {
            for (String part : s.split(",")) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) continue;
                values.add(upperCase ? trimmed.toUpperCase(Locale.ROOT) : trimmed);
            }
            return values;
        }
        values.add(raw);
        return values;
    }
}
