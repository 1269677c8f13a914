package com.credo.cache.domain.error;

/**
 * A value handed to the cache could not be written as JSON.
 */
public class CacheSerializationException extends CacheException {

    private static final long serialVersionUID = 1L;

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
