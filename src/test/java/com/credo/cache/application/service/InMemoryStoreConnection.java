package com.credo.cache.application.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;

import com.credo.cache.application.port.out.StoreConnection;
import com.credo.cache.application.port.out.StoreError;
import com.credo.cache.application.port.out.StoreErrorListener;

/**
 * In-memory StoreConnection for adapter tests.
 * <p>
 * Commands complete synchronously. Expiry runs against a manual clock moved
 * with {@link #advanceMillis(long)}. {@link #failWith(RuntimeException)} makes
 * every later command fail.
 * </p>
 */
class InMemoryStoreConnection implements StoreConnection {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final List<StoreErrorListener> errorListeners = new CopyOnWriteArrayList<>();
    private final AtomicLong nowMillis = new AtomicLong();
    private final AtomicInteger commandCount = new AtomicInteger();
    private final AtomicInteger closeCount = new AtomicInteger();

    private volatile RuntimeException failure;
    private volatile BiFunction<List<String>, List<String>, Object> scriptHandler = (keys, args) -> null;

    private volatile String lastScript;
    private volatile List<String> lastScriptKeys;
    private volatile List<String> lastScriptArgs;

    // ─────────────────── StoreConnection ───────────────────

    @Override
    public CompletableFuture<String> get(String key) {
        commandCount.incrementAndGet();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(read(key));
    }

    @Override
    public CompletableFuture<List<String>> mget(List<String> keys) {
        commandCount.incrementAndGet();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        List<String> values = new ArrayList<>(keys.size());
        for (String key : keys) {
            values.add(read(key));
        }
        return CompletableFuture.completedFuture(values);
    }

    @Override
    public CompletableFuture<Void> set(String key, String value) {
        commandCount.incrementAndGet();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        entries.put(key, new Entry(value, Long.MAX_VALUE));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> setex(String key, long seconds, String value) {
        commandCount.incrementAndGet();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        entries.put(key, new Entry(value, nowMillis.get() + seconds * 1000));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Long> del(List<String> keys) {
        commandCount.incrementAndGet();
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        long removed = 0;
        for (String key : keys) {
            if (read(key) != null) {
                removed++;
            }
            entries.remove(key);
        }
        return CompletableFuture.completedFuture(removed);
    }

    @Override
    public CompletableFuture<Object> eval(String script, List<String> keys, List<String> args) {
        commandCount.incrementAndGet();
        lastScript = script;
        lastScriptKeys = keys;
        lastScriptArgs = args;
        if (failure != null) {
            return CompletableFuture.failedFuture(failure);
        }
        return CompletableFuture.completedFuture(scriptHandler.apply(keys, args));
    }

    @Override
    public CompletableFuture<Void> connect() {
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void onError(StoreErrorListener listener) {
        errorListeners.add(listener);
    }

    @Override
    public void close() {
        closeCount.incrementAndGet();
    }

    // ─────────────────── Test Controls ───────────────────

    void putRaw(String key, String raw) {
        entries.put(key, new Entry(raw, Long.MAX_VALUE));
    }

    void advanceMillis(long millis) {
        nowMillis.addAndGet(millis);
    }

    void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    void onScript(BiFunction<List<String>, List<String>, Object> handler) {
        this.scriptHandler = handler;
    }

    void emit(StoreError error) {
        for (StoreErrorListener listener : errorListeners) {
            listener.onError(error);
        }
    }

    int commandCount() {
        return commandCount.get();
    }

    int closeCount() {
        return closeCount.get();
    }

    String lastScript() {
        return lastScript;
    }

    List<String> lastScriptKeys() {
        return lastScriptKeys;
    }

    List<String> lastScriptArgs() {
        return lastScriptArgs;
    }

    private String read(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAtMillis <= nowMillis.get()) {
            entries.remove(key);
            return null;
        }
        return entry.value;
    }

    private record Entry(String value, long expiresAtMillis) {
    }
}
