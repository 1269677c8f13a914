package com.credo.cache.domain.config;

import java.util.Objects;

import com.credo.cache.domain.retry.ReconnectPolicy;

/**
 * Immutable connection settings for the Redis server backing a cache.
 * <p>
 * The prefix, when set, namespaces every key the cache touches. The reconnect
 * policy is optional; callers that leave it out get the default policy when the
 * cache is connected.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>host is never null (blank input falls back to {@code localhost})</li>
 * <li>port is within 1..65535</li>
 * <li>password is never null (empty means no authentication)</li>
 * <li>prefix is never null (empty means no namespace)</li>
 * </ul>
 */
public final class RedisConnectionConfig {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 6379;

    private final String host;
    private final int port;
    private final String password;
    private final String prefix;
    private final ReconnectPolicy reconnectPolicy;

    public RedisConnectionConfig(String host, int port, String password, String prefix,
            ReconnectPolicy reconnectPolicy) {
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be within 1..65535 but was " + port);
        }

        this.host = host == null || host.isBlank() ? DEFAULT_HOST : host;
        this.port = port;
        this.password = password != null ? password : "";
        this.prefix = prefix != null ? prefix : "";
        this.reconnectPolicy = reconnectPolicy;
    }

    public RedisConnectionConfig(String host, int port, String password) {
        this(host, port, password, null, null);
    }

    // ─────────────────── Copy Methods ───────────────────

    public RedisConnectionConfig withPrefix(String prefix) {
        return new RedisConnectionConfig(host, port, password, prefix, reconnectPolicy);
    }

    public RedisConnectionConfig withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
        return new RedisConnectionConfig(host, port, password, prefix, reconnectPolicy);
    }

    // ─────────────────── Getters ───────────────────

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getPassword() {
        return password;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * @return the configured policy, or null when the default should be installed
     */
    public ReconnectPolicy getReconnectPolicy() {
        return reconnectPolicy;
    }

    public boolean hasReconnectPolicy() {
        return reconnectPolicy != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof RedisConnectionConfig))
            return false;
        RedisConnectionConfig that = (RedisConnectionConfig) o;
        return port == that.port
                && host.equals(that.host)
                && password.equals(that.password)
                && prefix.equals(that.prefix)
                && Objects.equals(reconnectPolicy, that.reconnectPolicy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, password, prefix, reconnectPolicy);
    }

    // password is left out on purpose
    @Override
    public String toString() {
        return "RedisConnectionConfig{host='" + host + "', port=" + port
                + ", prefix='" + prefix + "', customRetry=" + hasReconnectPolicy() + "}";
    }
}
