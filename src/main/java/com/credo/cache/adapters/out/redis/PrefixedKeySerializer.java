package com.credo.cache.adapters.out.redis;

import java.nio.charset.StandardCharsets;

import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * UTF-8 key serializer that namespaces every key with a fixed prefix.
 * <p>
 * Key pattern: {@code {prefix}{key}}. Keys read back from Redis have the
 * prefix stripped again.
 * </p>
 */
public class PrefixedKeySerializer implements RedisSerializer<String> {

    private final String prefix;

    public PrefixedKeySerializer(String prefix) {
        this.prefix = prefix != null ? prefix : "";
    }

    @Override
    public byte[] serialize(String key) {
        if (key == null) {
            return null;
        }
        return (prefix + key).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String deserialize(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        String key = new String(bytes, StandardCharsets.UTF_8);
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    public String getPrefix() {
        return prefix;
    }
}
