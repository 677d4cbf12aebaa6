package com.pipeforge.compiler.workflow;

import java.util.List;

/**
 * One "Retry" entry of a Task or Map state.
 */
public record RetryPolicy(
        List<String> errorEquals,
        int          intervalSeconds,
        int          maxAttempts,
        double       backoffRate) {

    public static final String THROTTLING_ERROR = "Lambda.TooManyRequestsException";
    public static final String ALL_ERRORS       = "States.ALL";
    public static final double BACKOFF_RATE     = 2.0;

    // Fast tier for transient capacity errors.
    private static final int THROTTLING_INTERVAL_SECONDS = 1;
    private static final int THROTTLING_MAX_ATTEMPTS     = 5;

    public RetryPolicy {
        errorEquals = List.copyOf(errorEquals);
    }

    /**
     * The two-tier policy used by every invocable state: throttling errors
     * first, then everything else with the pipeline's own interval and
     * attempt count.
     */
    public static List<RetryPolicy> twoTier(int genericIntervalSeconds, int genericMaxAttempts) {
        return List.of(
                new RetryPolicy(List.of(THROTTLING_ERROR),
                        THROTTLING_INTERVAL_SECONDS, THROTTLING_MAX_ATTEMPTS, BACKOFF_RATE),
                new RetryPolicy(List.of(ALL_ERRORS),
                        genericIntervalSeconds, genericMaxAttempts, BACKOFF_RATE));
    }
}
