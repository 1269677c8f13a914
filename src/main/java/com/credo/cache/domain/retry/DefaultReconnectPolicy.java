package com.credo.cache.domain.retry;

/**
 * Linear back-off reconnect policy.
 * <p>
 * Rules, evaluated in order:
 * </p>
 * <ol>
 * <li>server refused the connection → give up</li>
 * <li>retrying for longer than {@code maxRetryTimeMs} → give up</li>
 * <li>otherwise wait {@code min(attempt × intervalStepMs, maxIntervalMs)}</li>
 * </ol>
 */
public class DefaultReconnectPolicy implements ReconnectPolicy {

    private final RetrySettings settings;

    public DefaultReconnectPolicy(RetrySettings settings) {
        if (settings == null)
            throw new IllegalArgumentException("settings cannot be null");
        this.settings = settings;
    }

    public DefaultReconnectPolicy() {
        this(RetrySettings.DEFAULTS);
    }

    @Override
    public ReconnectDecision evaluate(ReconnectAttempt attempt, ReconnectContext context) {
        if (attempt.isConnectionRefused()) {
            return ReconnectDecision.giveUp("The server refused the connection");
        }
        if (attempt.totalRetryTimeMs() > settings.maxRetryTimeMs()) {
            return ReconnectDecision.giveUp("Retry time exhausted");
        }

        context.logger().warn("action=redis_connection_lost cache={} attempt={} message={}",
                context.cacheName(), attempt.attempt(), "Redis connection lost. Trying to reconnect");
        return ReconnectDecision.retryAfter(
                Math.min(attempt.attempt() * settings.intervalStepMs(), settings.maxIntervalMs()));
    }

    public RetrySettings getSettings() {
        return settings;
    }
}
