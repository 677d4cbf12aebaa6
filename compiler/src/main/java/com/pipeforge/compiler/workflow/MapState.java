package com.pipeforge.compiler.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the iterator workflow once per item found at {@link #itemsPath()}.
 *
 * The result of the iteration is discarded ("ResultPath": null) so the
 * state's input flows on unchanged.
 *
 * @param maxConcurrency null when unbounded; the field is then omitted from
 *                       the document entirely
 */
public record MapState(
        String              itemsPath,
        CompiledWorkflow    iterator,
        Integer             maxConcurrency,
        Map<String, Object> parameters,
        List<RetryPolicy>   retry,
        String              next) implements ChainingState {

    public MapState {
        parameters = parameters == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        retry      = retry == null ? List.of() : List.copyOf(retry);
    }

    @Override public String type() { return "Map"; }

    @Override
    public MapState withNext(String next) {
        return new MapState(itemsPath, iterator, maxConcurrency, parameters, retry, next);
    }

    public MapState withItemsPath(String itemsPath) {
        return new MapState(itemsPath, iterator, maxConcurrency, parameters, retry, next);
    }
}
