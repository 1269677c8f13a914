package com.credo.cache.application.port.in;

import com.credo.cache.domain.error.CacheException;

/**
 * Receives failures of fire-and-forget cache operations and of the store
 * connection itself.
 * <p>
 * Called on the store's I/O thread; implementations should return quickly.
 * </p>
 */
@FunctionalInterface
public interface CacheErrorListener {

    void onError(CacheException error);
}
