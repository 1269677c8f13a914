package com.credo.cache.bootstrap.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.credo.cache.domain.config.CacheConfig;
import com.credo.cache.domain.config.RedisConnectionConfig;
import com.credo.cache.domain.retry.RetrySettings;

@ConfigurationProperties(prefix = "credo.cache")
public class CacheProperties {

    private String name = CacheConfig.DEFAULT_NAME;
    private final Redis redis = new Redis();
    private final Retry retry = new Retry();
    private final Rest rest = new Rest();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Redis getRedis() {
        return redis;
    }

    public Retry getRetry() {
        return retry;
    }

    public Rest getRest() {
        return rest;
    }

    public CacheConfig toCacheConfig() {
        return new CacheConfig(name, new RedisConnectionConfig(
                redis.getHost(), redis.getPort(), redis.getPassword(), redis.getPrefix(), null));
    }

    public static class Redis {
        private String host = RedisConnectionConfig.DEFAULT_HOST;
        private int port = RedisConnectionConfig.DEFAULT_PORT;
        private String password = "";
        private String prefix = "";

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }
    }

    public static class Retry {
        private long maxRetryTimeMs = RetrySettings.MAX_RETRY_TIME_MS;
        private long intervalStepMs = RetrySettings.RETRY_INTERVAL_STEP_MS;
        private long maxIntervalMs = RetrySettings.MAX_RETRY_INTERVAL_MS;

        public long getMaxRetryTimeMs() {
            return maxRetryTimeMs;
        }

        public void setMaxRetryTimeMs(long maxRetryTimeMs) {
            this.maxRetryTimeMs = maxRetryTimeMs;
        }

        public long getIntervalStepMs() {
            return intervalStepMs;
        }

        public void setIntervalStepMs(long intervalStepMs) {
            this.intervalStepMs = intervalStepMs;
        }

        public long getMaxIntervalMs() {
            return maxIntervalMs;
        }

        public void setMaxIntervalMs(long maxIntervalMs) {
            this.maxIntervalMs = maxIntervalMs;
        }

        public RetrySettings toSettings() {
            return new RetrySettings(maxRetryTimeMs, intervalStepMs, maxIntervalMs);
        }
    }

    public static class Rest {
        private long timeoutMs = 3000;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
