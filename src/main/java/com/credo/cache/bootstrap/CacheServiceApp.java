package com.credo.cache.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisReactiveAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.credo.cache.bootstrap.config.CacheProperties;

/**
 * Credo Cache - Application Entry Point.
 * <p>
 * Runs a single Redis-backed cache and exposes it over a small REST surface
 * for inspection and testing.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Tech:         Spring Boot 3.2 + Spring Data Redis (Lettuce) + Jackson
 * </pre>
 * <p>
 * Boot's own Redis auto-configuration is excluded: the cache owns its
 * connection factory.
 * </p>
 */
@SpringBootApplication(scanBasePackages = "com.credo.cache", exclude = {
        RedisAutoConfiguration.class,
        RedisReactiveAutoConfiguration.class,
        RedisRepositoriesAutoConfiguration.class })
@EnableConfigurationProperties(CacheProperties.class)
public class CacheServiceApp {

    public static void main(String[] args) {
        SpringApplication.run(CacheServiceApp.class, args);
    }
}
