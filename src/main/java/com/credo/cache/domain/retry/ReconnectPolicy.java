package com.credo.cache.domain.retry;

/**
 * Decides how a lost store connection is re-established.
 * <p>
 * Implementations must be pure apart from logging: the same attempt always
 * yields the same decision. Anything the policy wants to log with is passed in
 * through the {@link ReconnectContext}.
 * </p>
 */
@FunctionalInterface
public interface ReconnectPolicy {

    /**
     * @param attempt state of the current reconnect cycle
     * @param context cache name and logger for diagnostics
     * @return delay before the next attempt, or a terminal error
     */
    ReconnectDecision evaluate(ReconnectAttempt attempt, ReconnectContext context);
}
