package com.credo.cache.domain.retry;

/**
 * Tuning for the {@link DefaultReconnectPolicy}.
 *
 * @param maxRetryTimeMs  give up once retrying has lasted longer than this
 * @param intervalStepMs  delay added per attempt
 * @param maxIntervalMs   upper bound for a single delay
 */
public record RetrySettings(long maxRetryTimeMs, long intervalStepMs, long maxIntervalMs) {

    /** 1 minute */
    public static final long MAX_RETRY_TIME_MS = 60_000;

    /** 200 milliseconds */
    public static final long RETRY_INTERVAL_STEP_MS = 200;

    /** 3 seconds */
    public static final long MAX_RETRY_INTERVAL_MS = 3_000;

    public static final RetrySettings DEFAULTS = new RetrySettings(
            MAX_RETRY_TIME_MS, RETRY_INTERVAL_STEP_MS, MAX_RETRY_INTERVAL_MS);

    public RetrySettings {
        if (maxRetryTimeMs <= 0) {
            throw new IllegalArgumentException("maxRetryTimeMs must be positive");
        }
        if (intervalStepMs <= 0) {
            throw new IllegalArgumentException("intervalStepMs must be positive");
        }
        if (maxIntervalMs < intervalStepMs) {
            throw new IllegalArgumentException("maxIntervalMs cannot be smaller than intervalStepMs");
        }
    }
}
