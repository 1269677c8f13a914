package com.credo.cache.adapters.out.redis;

import com.credo.cache.application.port.out.StoreError;

import io.lettuce.core.RedisCommandExecutionException;

/**
 * Maps Lettuce failures onto {@link StoreError} kinds.
 * <p>
 * A {@code NOAUTH} reply seen while reconnecting means a command reached the
 * server before the re-authentication handshake finished. Lettuce retries it
 * once the handshake completes, so it is tagged
 * {@link StoreError.Kind#RECONNECT_AUTH} instead of being reported.
 * </p>
 */
final class StoreErrorClassifier {

    private static final String NOAUTH_REPLY = "NOAUTH";

    private StoreErrorClassifier() {
    }

    static StoreError classifyReconnectFailure(Throwable cause) {
        if (hasNoAuthReply(cause)) {
            return new StoreError(StoreError.Kind.RECONNECT_AUTH, cause);
        }
        return StoreError.transport(cause);
    }

    static boolean hasNoAuthReply(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RedisCommandExecutionException
                    && current.getMessage() != null
                    && current.getMessage().startsWith(NOAUTH_REPLY)) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
