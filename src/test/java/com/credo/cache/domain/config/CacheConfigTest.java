package com.credo.cache.domain.config;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.credo.cache.domain.retry.DefaultReconnectPolicy;

@DisplayName("CacheConfig / RedisConnectionConfig Tests")
class CacheConfigTest {

    @Test
    @DisplayName("missing redis settings fail at construction")
    void testMissingRedis() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> new CacheConfig("testcache", null));

        assertEquals("Cannot create Cache: redis settings are undefined", error.getMessage());
    }

    @Test
    @DisplayName("name defaults to 'cache'")
    void testDefaultName() {
        RedisConnectionConfig redis = new RedisConnectionConfig("localhost", 6379, "");

        assertEquals("cache", new CacheConfig(redis).getName());
        assertEquals("cache", new CacheConfig("  ", redis).getName());
        assertEquals("testcache", new CacheConfig("testcache", redis).getName());
    }

    @Test
    @DisplayName("blank host, null password and null prefix are normalized")
    void testRedisDefaults() {
        RedisConnectionConfig redis = new RedisConnectionConfig("", 6379, null, null, null);

        assertEquals("localhost", redis.getHost());
        assertEquals("", redis.getPassword());
        assertEquals("", redis.getPrefix());
        assertFalse(redis.hasReconnectPolicy());
    }

    @Test
    @DisplayName("ports outside 1..65535 are rejected")
    void testInvalidPort() {
        assertThrows(IllegalArgumentException.class, () -> new RedisConnectionConfig("h", 0, ""));
        assertThrows(IllegalArgumentException.class, () -> new RedisConnectionConfig("h", 70000, ""));
    }

    @Test
    @DisplayName("copy methods keep the other settings")
    void testCopies() {
        DefaultReconnectPolicy policy = new DefaultReconnectPolicy();
        RedisConnectionConfig redis = new RedisConnectionConfig("redis", 6380, "secret")
                .withPrefix("testcache:")
                .withReconnectPolicy(policy);

        assertEquals("redis", redis.getHost());
        assertEquals(6380, redis.getPort());
        assertEquals("secret", redis.getPassword());
        assertEquals("testcache:", redis.getPrefix());
        assertSame(policy, redis.getReconnectPolicy());
    }

    @Test
    @DisplayName("toString never shows the password")
    void testToString_HidesPassword() {
        assertFalse(new RedisConnectionConfig("redis", 6379, "secret").toString().contains("secret"));
    }
}
