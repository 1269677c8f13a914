package com.credo.cache.bootstrap;

import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.credo.cache.adapters.out.redis.RedisStoreConnection;
import com.credo.cache.application.port.in.Cache;
import com.credo.cache.application.port.in.CacheErrorListener;
import com.credo.cache.application.service.CacheAdapter;
import com.credo.cache.application.service.CacheTracer;
import com.credo.cache.application.service.JsonValueCodec;
import com.credo.cache.domain.config.CacheConfig;
import com.credo.cache.domain.config.RedisConnectionConfig;
import com.credo.cache.domain.retry.DefaultReconnectPolicy;
import com.credo.cache.domain.retry.ReconnectPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Entry point for obtaining a Redis-backed {@link Cache} outside of Spring.
 */
public final class CacheFactory {

    private static final Logger log = LoggerFactory.getLogger(CacheFactory.class);

    private CacheFactory() {
    }

    /**
     * Connects a cache to the Redis server described by {@code config}.
     * <p>
     * Installs {@link DefaultReconnectPolicy} when the config carries no
     * reconnect policy.
     * </p>
     *
     * @param config        cache settings, required
     * @param objectMapper  mapper for cache values, required
     * @param meterRegistry registry for operation timings, may be null
     * @return a future already completed with the cache
     * @throws IllegalArgumentException if {@code config} is missing
     */
    public static CompletableFuture<Cache> connect(CacheConfig config, ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        if (config == null)
            throw new IllegalArgumentException("Cannot create Cache: config is undefined");
        return CompletableFuture.completedFuture(create(config, objectMapper, meterRegistry));
    }

    /**
     * Synchronous variant of {@link #connect}.
     */
    public static CacheAdapter create(CacheConfig config, ObjectMapper objectMapper, MeterRegistry meterRegistry) {
        return create(config, objectMapper, meterRegistry, null);
    }

    /**
     * Like {@link #create(CacheConfig, ObjectMapper, MeterRegistry)}, with
     * {@code errorListener} subscribed before the first connection attempt so
     * it also hears about failures to connect.
     */
    public static CacheAdapter create(CacheConfig config, ObjectMapper objectMapper, MeterRegistry meterRegistry,
            CacheErrorListener errorListener) {
        if (config == null)
            throw new IllegalArgumentException("Cannot create Cache: config is undefined");
        if (objectMapper == null)
            throw new IllegalArgumentException("objectMapper cannot be null");

        RedisConnectionConfig redis = config.getRedis();
        ReconnectPolicy policy = redis.hasReconnectPolicy()
                ? redis.getReconnectPolicy()
                : new DefaultReconnectPolicy();

        RedisStoreConnection connection = RedisStoreConnection.open(config.getName(), redis, policy);
        log.info("action=cache_created cache={} customRetry={}", config.getName(), redis.hasReconnectPolicy());

        CacheAdapter cache = new CacheAdapter(
                config.getName(),
                connection,
                new JsonValueCodec(objectMapper),
                new CacheTracer(config.getName(), meterRegistry));
        if (errorListener != null) {
            cache.onError(errorListener);
        }
        connection.connect();
        return cache;
    }
}
