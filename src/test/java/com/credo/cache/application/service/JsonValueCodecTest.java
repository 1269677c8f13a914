package com.credo.cache.application.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.credo.cache.domain.error.CacheDeserializationException;
import com.credo.cache.domain.error.CacheSerializationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

@DisplayName("JsonValueCodec Tests")
class JsonValueCodecTest {

    private final JsonValueCodec codec = new JsonValueCodec(new ObjectMapper());

    @Test
    @DisplayName("null and empty text decode as absent")
    void testDecode_Absent() {
        assertNull(codec.decode(null, Object.class));
        assertNull(codec.decode("", Object.class));
    }

    @Test
    @DisplayName("untyped decode yields plain JSON types")
    void testDecode_Untyped() {
        Object value = codec.decode("{\"list\":[1,2],\"flag\":true,\"text\":\"x\"}", Object.class);

        assertEquals(Map.of("list", List.of(1, 2), "flag", true, "text", "x"), value);
    }

    @Test
    @DisplayName("invalid JSON raises a deserialization error carrying the raw text")
    void testDecode_Invalid() {
        CacheDeserializationException error = assertThrows(CacheDeserializationException.class,
                () -> codec.decode("{broken", Object.class));

        assertEquals("{broken", error.getRawValue());
        assertEquals("Failed to deserialize cache value {broken", error.getMessage());
        assertNotNull(error.getCause());
    }

    @Test
    @DisplayName("text with trailing tokens after the first value is malformed")
    void testDecode_TrailingTokens() {
        CacheDeserializationException error = assertThrows(CacheDeserializationException.class,
                () -> codec.decode("1 2", Object.class));

        assertEquals("1 2", error.getRawValue());
        assertThrows(CacheDeserializationException.class, () -> codec.decode("{\"a\":1} x", Object.class));
    }

    @Test
    @DisplayName("convert() binds decoded values to the requested type")
    void testConvert() {
        assertEquals(Integer.valueOf(5), codec.convert(5L, Integer.class));
        assertEquals(List.of(1, 2), codec.convert(List.of(1, 2), Object.class));
        assertNull(codec.convert(null, Object.class));
        assertThrows(CacheDeserializationException.class, () -> codec.convert("text", Map.class));
    }

    @Test
    @DisplayName("null encodes as the JSON literal null")
    void testEncode_Null() {
        assertEquals("null", codec.encode(null));
    }

    @Test
    @DisplayName("encoding uses the configured mapper")
    void testEncode_ConfiguredMapper() {
        // Given
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        JsonValueCodec isoCodec = new JsonValueCodec(mapper);

        // When
        String json = isoCodec.encode(Map.of("at", Instant.parse("2024-01-02T03:04:05Z")));

        // Then
        assertEquals("{\"at\":\"2024-01-02T03:04:05Z\"}", json);
    }

    @Test
    @DisplayName("unwritable values raise a serialization error")
    void testEncode_Unwritable() {
        assertThrows(CacheSerializationException.class, () -> codec.encode(new Object()));
    }
}
