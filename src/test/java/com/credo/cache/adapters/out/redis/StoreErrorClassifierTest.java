package com.credo.cache.adapters.out.redis;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.credo.cache.application.port.out.StoreError;

import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisConnectionException;

@DisplayName("StoreErrorClassifier Tests")
class StoreErrorClassifierTest {

    @Test
    @DisplayName("a NOAUTH reply during reconnect is classified as reconnect noise")
    void testNoAuth() {
        Throwable cause = new RedisConnectionException("Unable to connect",
                new RedisCommandExecutionException("NOAUTH Authentication required."));

        StoreError error = StoreErrorClassifier.classifyReconnectFailure(cause);

        assertEquals(StoreError.Kind.RECONNECT_AUTH, error.kind());
        assertTrue(error.isTransientReconnectNoise());
        assertSame(cause, error.cause());
    }

    @Test
    @DisplayName("a wrong password is a real failure")
    void testWrongPass() {
        Throwable cause = new RedisCommandExecutionException("WRONGPASS invalid username-password pair");

        assertEquals(StoreError.Kind.TRANSPORT, StoreErrorClassifier.classifyReconnectFailure(cause).kind());
    }

    @Test
    @DisplayName("other failures are transport errors")
    void testTransport() {
        Throwable cause = new RedisConnectionException("Connection refused");

        StoreError error = StoreErrorClassifier.classifyReconnectFailure(cause);

        assertEquals(StoreError.Kind.TRANSPORT, error.kind());
        assertFalse(error.isTransientReconnectNoise());
    }
}
