package com.pipeforge.compiler.model;

/**
 * Pipeline-level settings supplied with the graph.
 *
 * @param retryAttempts        attempts for the generic retry tier of every Task
 * @param retryIntervalSeconds interval for the generic retry tier
 * @param timeoutSeconds       whole-execution timeout; 0 means none
 * @param autoStart            carried through for deployment, not interpreted here
 */
public record PipelineSettings(
        Integer retryAttempts,
        Integer retryIntervalSeconds,
        Integer timeoutSeconds,
        Boolean autoStart) {

    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_RETRY_INTERVAL_SECONDS = 2;

    // Compact constructor: fill defaults for anything the editor left out.
    public PipelineSettings {
        if (retryAttempts == null || retryAttempts < 0)               retryAttempts = DEFAULT_RETRY_ATTEMPTS;
        if (retryIntervalSeconds == null || retryIntervalSeconds < 1) retryIntervalSeconds = DEFAULT_RETRY_INTERVAL_SECONDS;
        if (timeoutSeconds == null || timeoutSeconds < 0)             timeoutSeconds = 0;
        if (autoStart == null)                                        autoStart = Boolean.FALSE;
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(null, null, null, null);
    }

    public boolean hasTimeout() {
        return timeoutSeconds > 0;
    }
}
