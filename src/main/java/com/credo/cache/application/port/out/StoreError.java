package com.credo.cache.application.port.out;

/**
 * Connection-level failure reported by a {@link StoreConnection}.
 * <p>
 * The store implementation classifies its own errors, so the cache never
 * inspects driver-specific exception types.
 * </p>
 *
 * @param kind  classification of the failure
 * @param cause driver exception
 */
public record StoreError(Kind kind, Throwable cause) {

    public enum Kind {

        /** Transport or server failure worth reporting */
        TRANSPORT,

        /** Authentication rejected while a reconnect handshake was in flight */
        RECONNECT_AUTH,

        /** Reconnect policy gave up; the connection will not recover on its own */
        RETRY_ABANDONED
    }

    public StoreError {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
    }

    public static StoreError transport(Throwable cause) {
        return new StoreError(Kind.TRANSPORT, cause);
    }

    public boolean isTransientReconnectNoise() {
        return kind == Kind.RECONNECT_AUTH;
    }
}
