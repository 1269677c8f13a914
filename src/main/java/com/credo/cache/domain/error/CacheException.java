package com.credo.cache.domain.error;

/**
 * Failure raised by the cache layer on top of a store or codec error.
 * <p>
 * Always carries the underlying cause. The message names the cache operation
 * that failed, e.g. "Failed to retrieve a value from cache".
 * </p>
 */
public class CacheException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
