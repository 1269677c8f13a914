package com.credo.cache.application.port.in;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Primary (inbound) port: a simplified cache over an external key-value store.
 * <p>
 * Values are stored as JSON text. Request/response operations ({@code get},
 * {@code execute}) report store failures by completing their future
 * exceptionally with a {@link com.credo.cache.domain.error.CacheException}.
 * Fire-and-forget operations ({@code set}, {@code clear}) report them only to
 * listeners registered through {@link #onError(CacheErrorListener)}.
 * </p>
 * <p>
 * Every operation validates its arguments before touching the store and throws
 * {@link IllegalArgumentException} synchronously when they are missing.
 * </p>
 */
public interface Cache extends AutoCloseable {

    /**
     * @return cache name used in logs and timings
     */
    String getName();

    /**
     * Retrieves a single value as plain JSON types (maps, lists, strings,
     * numbers, booleans).
     *
     * @param key cache key
     * @return the stored value, or null if absent or unreadable
     */
    CompletableFuture<Object> get(String key);

    /**
     * Retrieves a single value bound to the given type.
     *
     * @param key  cache key
     * @param type target type
     * @return the stored value, or null if absent or unreadable
     */
    <T> CompletableFuture<T> get(String key, Class<T> type);

    /**
     * Retrieves several values in one round trip.
     *
     * @param keys cache keys
     * @return values positionally aligned with {@code keys}; null marks absent
     *         or unreadable entries
     */
    CompletableFuture<List<Object>> get(List<String> keys);

    /**
     * Typed variant of {@link #get(List)}.
     */
    <T> CompletableFuture<List<T>> get(List<String> keys, Class<T> type);

    /**
     * Stores a value without expiration.
     *
     * @param key   cache key
     * @param value JSON-serializable value
     */
    void set(String key, Object value);

    /**
     * Stores a value.
     *
     * @param key            cache key
     * @param value          JSON-serializable value
     * @param expiresSeconds time to live; 0 stores without expiration
     */
    void set(String key, Object value, long expiresSeconds);

    /**
     * Removes a single key.
     */
    void clear(String key);

    /**
     * Removes several keys in one command.
     */
    void clear(List<String> keys);

    /**
     * Runs a server-side script without keys or parameters.
     */
    CompletableFuture<Object> execute(String script);

    /**
     * Runs a server-side script. The store receives the key count, then the
     * keys, then the parameters.
     *
     * @param script     script body
     * @param keys       key arguments, may be null for none
     * @param parameters extra arguments, may be null for none
     * @return the script result: text replies parsed as JSON, integers as
     *         numbers, arrays as lists; null for no result
     */
    CompletableFuture<Object> execute(String script, List<String> keys, List<String> parameters);

    /**
     * Typed variant of {@link #execute(String, List, List)}.
     */
    <T> CompletableFuture<T> execute(String script, List<String> keys, List<String> parameters, Class<T> type);

    /**
     * Registers a listener for errors that have no caller to report to.
     */
    void onError(CacheErrorListener listener);

    /**
     * @return true if the listener was registered
     */
    boolean removeErrorListener(CacheErrorListener listener);

    /**
     * Releases the underlying store connection.
     */
    @Override
    void close();
}
