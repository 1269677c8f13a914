package com.credo.cache.application.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.credo.cache.application.port.in.Cache;
import com.credo.cache.application.port.in.CacheErrorListener;
import com.credo.cache.application.port.out.StoreConnection;
import com.credo.cache.application.port.out.StoreError;
import com.credo.cache.domain.error.CacheDeserializationException;
import com.credo.cache.domain.error.CacheException;

/**
 * Core use-case implementation: translates cache verbs into store commands.
 * <p>
 * The adapter keeps no local copy of any entry. Its own logic is limited to
 * argument checks, JSON encode/decode and wrapping store failures into
 * {@link CacheException}.
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>missing arguments → {@link IllegalArgumentException}, thrown before any
 * store call</li>
 * <li>get/execute store failures → returned future completes
 * exceptionally</li>
 * <li>set/clear store failures and connection errors → error listeners
 * only</li>
 * <li>unreadable stored JSON → warning, entry resolves to null</li>
 * <li>auth failure during reconnect → warning, not reported</li>
 * </ul>
 */
public class CacheAdapter implements Cache {

    private static final Logger log = LoggerFactory.getLogger(CacheAdapter.class);

    static final String GET_ONE_FAILED = "Failed to retrieve a value from cache";
    static final String GET_MANY_FAILED = "Failed to retrieve values from cache";
    static final String SET_FAILED = "Failed to store a value in cache";
    static final String CLEAR_FAILED = "Failed to clear cache items";
    static final String EXECUTE_FAILED = "Failed to execute cache script";
    static final String CONNECTION_FAILED = "Cache error";

    private final String name;
    private final StoreConnection connection;
    private final JsonValueCodec codec;
    private final CacheTracer tracer;
    private final List<CacheErrorListener> errorListeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Constructor injection. The adapter owns the connection from here on.
     */
    public CacheAdapter(String name, StoreConnection connection, JsonValueCodec codec, CacheTracer tracer) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("name cannot be null or blank");
        if (connection == null)
            throw new IllegalArgumentException("connection cannot be null");
        if (codec == null)
            throw new IllegalArgumentException("codec cannot be null");
        if (tracer == null)
            throw new IllegalArgumentException("tracer cannot be null");

        this.name = name;
        this.connection = connection;
        this.codec = codec;
        this.tracer = tracer;

        connection.onError(this::handleStoreError);
    }

    @Override
    public String getName() {
        return name;
    }

    // ─────────────────── Get ───────────────────

    @Override
    public CompletableFuture<Object> get(String key) {
        return get(key, Object.class);
    }

    @Override
    public <T> CompletableFuture<T> get(String key, Class<T> type) {
        requireKey(key, "Cannot get values from cache: keys are undefined");
        requireType(type);
        long start = tracer.start();
        log.debug("action=cache_get cache={} key={}", name, key);

        CompletableFuture<T> result = new CompletableFuture<>();
        connection.get(key).whenComplete((raw, error) -> {
            tracer.record("get", start, error == null);
            if (error != null) {
                result.completeExceptionally(new CacheException(GET_ONE_FAILED, unwrap(error)));
                return;
            }
            result.complete(decodeOrNull(raw, type));
        });
        return result;
    }

    @Override
    public CompletableFuture<List<Object>> get(List<String> keys) {
        return get(keys, Object.class);
    }

    @Override
    public <T> CompletableFuture<List<T>> get(List<String> keys, Class<T> type) {
        requireKeys(keys, "Cannot get values from cache: keys are undefined");
        requireType(type);
        List<String> requested = List.copyOf(keys);
        long start = tracer.start();
        log.debug("action=cache_get_many cache={} keyCount={}", name, requested.size());

        CompletableFuture<List<T>> result = new CompletableFuture<>();
        connection.mget(requested).whenComplete((raws, error) -> {
            tracer.record("get", start, error == null);
            if (error != null) {
                result.completeExceptionally(new CacheException(GET_MANY_FAILED, unwrap(error)));
                return;
            }

            List<T> values = new ArrayList<>(requested.size());
            for (int i = 0; i < requested.size(); i++) {
                String raw = raws != null && i < raws.size() ? raws.get(i) : null;
                values.add(decodeOrNull(raw, type));
            }
            result.complete(values);
        });
        return result;
    }

    // ─────────────────── Set ───────────────────

    @Override
    public void set(String key, Object value) {
        set(key, value, 0);
    }

    @Override
    public void set(String key, Object value, long expiresSeconds) {
        requireKey(key, "Cannot set cache key: key is undefined");
        if (expiresSeconds < 0) {
            throw new IllegalArgumentException("Cannot set cache key: expires cannot be negative");
        }
        long start = tracer.start();
        log.debug("action=cache_set cache={} key={} expiresSeconds={}", name, key, expiresSeconds);

        String json = codec.encode(value);
        CompletableFuture<Void> command = expiresSeconds > 0
                ? connection.setex(key, expiresSeconds, json)
                : connection.set(key, json);

        command.whenComplete((ignored, error) -> {
            tracer.record("set", start, error == null);
            if (error != null) {
                emitError(new CacheException(SET_FAILED, unwrap(error)));
            }
        });
    }

    // ─────────────────── Clear ───────────────────

    @Override
    public void clear(String key) {
        requireKey(key, "Cannot clear cache keys: keys are undefined");
        clearKeys(List.of(key));
    }

    @Override
    public void clear(List<String> keys) {
        requireKeys(keys, "Cannot clear cache keys: keys are undefined");
        clearKeys(List.copyOf(keys));
    }

    private void clearKeys(List<String> keys) {
        long start = tracer.start();
        log.debug("action=cache_clear cache={} keyCount={}", name, keys.size());

        connection.del(keys).whenComplete((removed, error) -> {
            tracer.record("clear", start, error == null);
            if (error != null) {
                emitError(new CacheException(CLEAR_FAILED, unwrap(error)));
            }
        });
    }

    // ─────────────────── Execute ───────────────────

    @Override
    public CompletableFuture<Object> execute(String script) {
        return execute(script, null, null, Object.class);
    }

    @Override
    public CompletableFuture<Object> execute(String script, List<String> keys, List<String> parameters) {
        return execute(script, keys, parameters, Object.class);
    }

    @Override
    public <T> CompletableFuture<T> execute(String script, List<String> keys, List<String> parameters,
            Class<T> type) {
        if (script == null || script.isBlank()) {
            throw new IllegalArgumentException("Cannot execute cache script: script is undefined");
        }
        requireType(type);
        List<String> scriptKeys = keys != null ? List.copyOf(keys) : Collections.emptyList();
        List<String> scriptArgs = parameters != null ? List.copyOf(parameters) : Collections.emptyList();
        long start = tracer.start();
        log.debug("action=cache_execute cache={} keyCount={} paramCount={}",
                name, scriptKeys.size(), scriptArgs.size());

        CompletableFuture<T> result = new CompletableFuture<>();
        connection.eval(script, scriptKeys, scriptArgs).whenComplete((reply, error) -> {
            tracer.record("execute", start, error == null);
            if (error != null) {
                result.completeExceptionally(new CacheException(EXECUTE_FAILED, unwrap(error)));
                return;
            }
            result.complete(decodeReply(reply, type));
        });
        return result;
    }

    // ─────────────────── Error Channel ───────────────────

    @Override
    public void onError(CacheErrorListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("listener cannot be null");
        errorListeners.add(listener);
    }

    @Override
    public boolean removeErrorListener(CacheErrorListener listener) {
        return errorListeners.remove(listener);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("action=cache_closed cache={}", name);
            connection.close();
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private void handleStoreError(StoreError error) {
        if (error.isTransientReconnectNoise()) {
            log.warn("action=reconnect_auth_suppressed cache={} error={}", name, error.cause().getMessage());
            return;
        }
        emitError(new CacheException(CONNECTION_FAILED, error.cause()));
    }

    private void emitError(CacheException error) {
        if (errorListeners.isEmpty()) {
            log.warn("action=cache_error_unobserved cache={} error={} cause={}",
                    name, error.getMessage(), String.valueOf(error.getCause()));
            return;
        }
        for (CacheErrorListener listener : errorListeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                log.error("action=cache_error_listener_failed cache={} error={}", name, e.getMessage(), e);
            }
        }
    }

    private <T> T decodeOrNull(String raw, Class<T> type) {
        try {
            return codec.decode(raw, type);
        } catch (CacheDeserializationException e) {
            log.warn("action=cache_deserialize_error cache={} message={}", name, e.getMessage());
            return null;
        }
    }

    /**
     * Text replies are parsed as JSON. Integer and array replies are taken as
     * they are, with each array element parsed on its own.
     */
    private <T> T decodeReply(Object reply, Class<T> type) {
        if (reply == null || reply instanceof String) {
            return decodeOrNull((String) reply, type);
        }
        try {
            return codec.convert(decodeElements(reply), type);
        } catch (CacheDeserializationException e) {
            log.warn("action=cache_deserialize_error cache={} message={}", name, e.getMessage());
            return null;
        }
    }

    private Object decodeElements(Object reply) {
        if (reply instanceof String) {
            return decodeOrNull((String) reply, Object.class);
        }
        if (reply instanceof List) {
            List<?> elements = (List<?>) reply;
            List<Object> decoded = new ArrayList<>(elements.size());
            for (Object element : elements) {
                decoded.add(decodeElements(element));
            }
            return decoded;
        }
        return reply;
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    private static void requireKey(String key, String message) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
    }

    private static void requireKeys(List<String> keys, String message) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException(message);
        }
        for (String key : keys) {
            requireKey(key, message);
        }
    }

    private static void requireType(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }
}
