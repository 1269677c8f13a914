package com.credo.cache.application.service;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@DisplayName("CacheTracer Tests")
class CacheTracerTest {

    @Test
    @DisplayName("record() times the operation tagged by cache, operation and outcome")
    void testRecord_WithRegistry() {
        // Given
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        CacheTracer tracer = new CacheTracer("users", registry);

        // When
        tracer.record("get", tracer.start(), true);
        tracer.record("get", tracer.start(), true);
        tracer.record("get", tracer.start(), false);

        // Then
        Timer ok = registry.find(CacheTracer.TIMER_NAME)
                .tags("cache", "users", "operation", "get", "success", "true")
                .timer();
        Timer failed = registry.find(CacheTracer.TIMER_NAME)
                .tags("cache", "users", "operation", "get", "success", "false")
                .timer();
        assertNotNull(ok);
        assertNotNull(failed);
        assertEquals(2, ok.count());
        assertEquals(1, failed.count());
    }

    @Test
    @DisplayName("record() without a registry only logs")
    void testRecord_WithoutRegistry() {
        CacheTracer tracer = new CacheTracer("users", null);

        assertDoesNotThrow(() -> tracer.record("set", tracer.start(), true));
    }
}
