package com.credo.cache.domain.retry;

import org.slf4j.Logger;

/**
 * Diagnostics passed into every {@link ReconnectPolicy} evaluation.
 *
 * @param cacheName name of the cache whose connection is being retried
 * @param logger    logger owned by the connection, never null
 */
public record ReconnectContext(String cacheName, Logger logger) {

    public ReconnectContext {
        if (cacheName == null || cacheName.isBlank()) {
            throw new IllegalArgumentException("cacheName cannot be null or blank");
        }
        if (logger == null) {
            throw new IllegalArgumentException("logger cannot be null");
        }
    }
}
