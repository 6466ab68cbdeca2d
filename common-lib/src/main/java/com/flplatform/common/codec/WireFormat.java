package com.flplatform.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Map;

/**
 * Shared Jackson mapper for the transport shape of protocol records.
 *
 * <p>{@code toDict}/{@code fromDict} on the protocol records delegate here so that JSON
 * (and any map-based transport) sees one canonical field naming: the snake_case names
 * declared through {@code @JsonProperty}. Timestamps are {@link java.time.Instant}
 * values written as epoch seconds.
 *
 * <p>The canonical mapper additionally sorts properties and map keys; it is used
 * for signing so the digest does not depend on insertion order.
 */
public final class WireFormat {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    private WireFormat() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static Map<String, Object> toDict(Object value) {
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    public static <T> T fromDict(Map<String, ?> dict, Class<T> type) {
        return MAPPER.convertValue(dict, type);
    }

    public static byte[] toJsonBytes(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T fromJsonBytes(byte[] bytes, Class<T> type) {
        try {
            return MAPPER.readValue(bytes, type);
        } catch (java.io.IOException e) {
            throw new IllegalArgumentException("Unable to deserialize " + type.getSimpleName(), e);
        }
    }

    /** Key-sorted JSON encoding used as the signing input. */
    public static byte[] canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to canonicalize " + value.getClass().getSimpleName(), e);
        }
    }
}
