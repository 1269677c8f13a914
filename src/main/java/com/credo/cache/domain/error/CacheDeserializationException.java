package com.credo.cache.domain.error;

/**
 * Text read back from the store is not valid JSON for the requested type.
 * <p>
 * Never reaches cache callers: the cache logs it and resolves the affected
 * entry as absent.
 * </p>
 */
public class CacheDeserializationException extends CacheException {

    private static final long serialVersionUID = 1L;

    private final String rawValue;

    public CacheDeserializationException(String rawValue, Throwable cause) {
        super("Failed to deserialize cache value " + rawValue, cause);
        this.rawValue = rawValue;
    }

    public String getRawValue() {
        return rawValue;
    }
}
