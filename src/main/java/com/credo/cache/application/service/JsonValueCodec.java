package com.credo.cache.application.service;

import com.credo.cache.domain.error.CacheDeserializationException;
import com.credo.cache.domain.error.CacheSerializationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

/**
 * JSON text codec for cache values, backed by Jackson.
 * <p>
 * Stored text must hold exactly one JSON value; anything after it makes the
 * text malformed.
 * </p>
 */
public class JsonValueCodec {

    private final ObjectMapper objectMapper;
    private final ObjectReader reader;

    public JsonValueCodec(ObjectMapper objectMapper) {
        if (objectMapper == null)
            throw new IllegalArgumentException("objectMapper cannot be null");
        this.objectMapper = objectMapper;
        this.reader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * @param value any Jackson-serializable value, null encodes as {@code null}
     * @return JSON text
     * @throws CacheSerializationException if Jackson cannot write the value
     */
    public String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CacheSerializationException(
                    "Failed to serialize cache value of type " + value.getClass().getName(), e);
        }
    }

    /**
     * @param raw  stored text; null or empty means the entry is absent
     * @param type target type
     * @return decoded value, or null for an absent entry
     * @throws CacheDeserializationException if the text is not valid JSON for
     *                                       {@code type}
     */
    public <T> T decode(String raw, Class<T> type) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        try {
            return reader.forType(type).readValue(raw);
        } catch (JsonProcessingException e) {
            throw new CacheDeserializationException(raw, e);
        }
    }

    /**
     * Binds an already decoded value (number, list, map) to {@code type}.
     *
     * @throws CacheDeserializationException if the value does not fit
     *                                       {@code type}
     */
    public <T> T convert(Object value, Class<T> type) {
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        try {
            return objectMapper.convertValue(value, type);
        } catch (IllegalArgumentException e) {
            throw new CacheDeserializationException(String.valueOf(value), e);
        }
    }
}
