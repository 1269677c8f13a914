package com.credo.cache.application.service;

import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Records how long each cache operation took and whether it succeeded.
 * <p>
 * Timer: {@code credo.cache.operation} tagged with {@code cache},
 * {@code operation} and {@code success}. Without a registry only the debug
 * log line is written.
 * </p>
 */
public class CacheTracer {

    static final String TIMER_NAME = "credo.cache.operation";

    private static final Logger log = LoggerFactory.getLogger(CacheTracer.class);

    private final String cacheName;
    private final MeterRegistry meterRegistry;

    public CacheTracer(String cacheName, MeterRegistry meterRegistry) {
        this.cacheName = cacheName;
        this.meterRegistry = meterRegistry;
    }

    public long start() {
        return System.nanoTime();
    }

    public void record(String operation, long startNanos, boolean success) {
        long elapsedNanos = System.nanoTime() - startNanos;
        log.debug("action=cache_trace cache={} operation={} elapsedMs={} success={}",
                cacheName, operation, TimeUnit.NANOSECONDS.toMillis(elapsedNanos), success);

        if (meterRegistry != null) {
            Timer.builder(TIMER_NAME)
                    .tag("cache", cacheName)
                    .tag("operation", operation)
                    .tag("success", String.valueOf(success))
                    .register(meterRegistry)
                    .record(elapsedNanos, TimeUnit.NANOSECONDS);
        }
    }
}
