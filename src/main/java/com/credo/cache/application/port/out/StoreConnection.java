package com.credo.cache.application.port.out;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Secondary (outbound) port: session with the external key-value store.
 * <p>
 * Values cross this port as raw text; JSON handling stays in the cache. All
 * commands are asynchronous and must not block the caller. Implementations
 * could be Redis, an in-memory fake, etc.
 * </p>
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * @return raw value, or null when the key does not exist
     */
    CompletableFuture<String> get(String key);

    /**
     * @return raw values aligned with {@code keys}, null for missing keys
     */
    CompletableFuture<List<String>> mget(List<String> keys);

    CompletableFuture<Void> set(String key, String value);

    CompletableFuture<Void> setex(String key, long seconds, String value);

    /**
     * @return number of keys removed
     */
    CompletableFuture<Long> del(List<String> keys);

    /**
     * Evaluates a script using the key-count convention: number of keys, the
     * keys, then the remaining arguments.
     *
     * The reply keeps the shape the script returned: a {@code String} for
     * bulk and status replies, a {@code Long} for integers, a {@code List} of
     * such replies for arrays.
     *
     * @return script reply, or null when the script returned nothing
     */
    CompletableFuture<Object> eval(String script, List<String> keys, List<String> args);

    /**
     * Opens the underlying connection without waiting for it. Failures are
     * reported to the error listeners, and further attempts follow the
     * reconnect policy.
     *
     * @return completes once connected, or exceptionally when retrying was
     *         abandoned
     */
    CompletableFuture<Void> connect();

    /**
     * Subscribes to connection-level failures that are not tied to a command.
     */
    void onError(StoreErrorListener listener);

    @Override
    void close();
}
