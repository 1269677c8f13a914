package com.credo.cache.bootstrap.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.credo.cache.application.port.in.Cache;
import com.credo.cache.bootstrap.CacheFactory;
import com.credo.cache.domain.config.CacheConfig;
import com.credo.cache.domain.retry.DefaultReconnectPolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Application-level bean configuration.
 * <p>
 * Wires the cache (application layer) with its Redis store connection
 * (adapter layer) from {@code credo.cache.*} properties.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    private static final Logger log = LoggerFactory.getLogger(ApplicationConfig.class);

    /**
     * Jackson ObjectMapper used for cache values and REST payloads.
     * - Java 8 Time support (Instant, LocalDateTime, etc.)
     * - ISO-8601 dates instead of timestamps
     * - Lenient deserialization (ignore unknown properties)
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    /**
     * The cache. Owns its Redis connection and is closed with the context.
     * Errors from fire-and-forget operations are logged here.
     */
    @Bean(destroyMethod = "close")
    public Cache cache(CacheProperties properties,
            ObjectMapper objectMapper,
            ObjectProvider<MeterRegistry> meterRegistry) {
        CacheConfig base = properties.toCacheConfig();
        CacheConfig config = new CacheConfig(base.getName(), base.getRedis()
                .withReconnectPolicy(new DefaultReconnectPolicy(properties.getRetry().toSettings())));

        return CacheFactory.create(config, objectMapper, meterRegistry.getIfAvailable(),
                error -> log.error("action=cache_error cache={} error={} cause={}",
                        config.getName(), error.getMessage(), String.valueOf(error.getCause())));
    }
}
