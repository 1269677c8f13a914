package com.credo.cache.domain.config;

/**
 * Top-level cache settings: a name used to correlate logs and timings, and the
 * Redis connection the cache delegates to.
 */
public final class CacheConfig {

    public static final String DEFAULT_NAME = "cache";

    private final String name;
    private final RedisConnectionConfig redis;

    /**
     * @throws IllegalArgumentException if the redis settings are missing
     */
    public CacheConfig(String name, RedisConnectionConfig redis) {
        if (redis == null) {
            throw new IllegalArgumentException("Cannot create Cache: redis settings are undefined");
        }
        this.name = name == null || name.isBlank() ? DEFAULT_NAME : name;
        this.redis = redis;
    }

    public CacheConfig(RedisConnectionConfig redis) {
        this(null, redis);
    }

    public String getName() {
        return name;
    }

    public RedisConnectionConfig getRedis() {
        return redis;
    }

    @Override
    public String toString() {
        return "CacheConfig{name='" + name + "', redis=" + redis + "}";
    }
}
