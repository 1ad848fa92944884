package com.keyforge.node.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Derives deterministic cache keys from an operation type and its parameters.
 * <p>
 * The key is {@code operationType + ":" + sha256(canonicalJson(params))}, where canonical
 * JSON orders map entries and bean properties by name, so equal parameter maps always
 * yield the same key regardless of insertion order.
 */
public final class CacheKeys {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private CacheKeys() {
    }

    public static String derive(String operationType, Map<String, ?> params) {
        if (operationType == null || operationType.isBlank()) {
            throw new IllegalArgumentException("Operation type cannot be null or blank");
        }
        return operationType + ":" + sha256Hex(canonicalJson(params == null ? Map.of() : params));
    }

    static String canonicalJson(Object params) {
        try {
            return CANONICAL.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache key parameters are not serialisable: " + e.getOriginalMessage(), e);
        }
    }

    private static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
