package com.pipeforge.compiler.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One node of a pipeline graph as authored in the editor.
 *
 * @param typeId        the node template id, e.g. "choice", "map" or "image_proxy".
 *                      For FLOW nodes it names the {@link FlowKind}.
 * @param configuration free-form key/value settings from the node's form
 */
public record Node(
        String              id,
        NodeRole            role,
        String              typeId,
        String              label,
        Map<String, Object> configuration) {

    public Node {
        configuration = configuration == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(configuration));
    }

    public Object config(String key) {
        return configuration.get(key);
    }

    /**
     * The nested "parameters" object of the configuration, or an empty map.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> parameters() {
        Object params = configuration.get("parameters");
        return params instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    /**
     * Resolves the flow step kind. An explicit "stepName" wins over the
     * template id, which wins over the label.
     */
    public Optional<FlowKind> flowKind() {
        if (role != NodeRole.FLOW) return Optional.empty();
        Object stepName = configuration.get("stepName");
        return FlowKind.fromName(stepName instanceof String s ? s : null)
                .or(() -> FlowKind.fromName(typeId))
                .or(() -> FlowKind.fromName(label));
    }

    public boolean isFlow(FlowKind kind) {
        return flowKind().filter(k -> k == kind).isPresent();
    }

    public String displayName() {
        if (label != null && !label.isBlank())   return label;
        if (typeId != null && !typeId.isBlank()) return typeId;
        return id;
    }
}
