package com.pipeforge.compiler.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes a compute unit identified by its handle.
 *
 * @param parameters invocation parameters, or null to pass the state input through
 */
public record TaskState(
        String              resource,
        Map<String, Object> parameters,
        List<RetryPolicy>   retry,
        String              next) implements ChainingState {

    public TaskState {
        parameters = parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        retry      = retry == null ? List.of() : List.copyOf(retry);
    }

    @Override public String type() { return "Task"; }

    @Override
    public TaskState withNext(String next) {
        return new TaskState(resource, parameters, retry, next);
    }
}
