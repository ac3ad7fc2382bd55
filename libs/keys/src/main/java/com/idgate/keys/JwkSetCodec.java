package com.idgate.keys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON mapping for JWK set documents and for the key list kept in the cache.
 * <p>
 * The cache holds only the {@code keys} array, serialized as a JSON array of
 * {@link JsonWebKey} objects.
 */
public final class JwkSetCodec {

    private static final Logger log = LoggerFactory.getLogger(JwkSetCodec.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<List<JsonWebKey>> KEY_LIST = new TypeReference<>() {};

    private JwkSetCodec() {
        // utility class
    }

    /**
     * A parsed JWK set document.
     *
     * @param keys  the {@code keys} array, or {@code null} if the document has none
     * @param error the {@code error} member as text, or {@code null}
     */
    public record Document(List<JsonWebKey> keys, String error) {}

    /**
     * Parses a JWK set response body ({@code {"keys": [...]}}).
     *
     * Entries of the {@code keys} array that cannot be mapped are skipped.
     *
     * @throws JwkSetFormatException if the body is not a JSON object
     */
    public static Document parseDocument(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new JwkSetFormatException("JWK set response is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new JwkSetFormatException("JWK set response is not a JSON object", null);
        }
        JsonNode error = root.get("error");
        String errorText = error == null || error.isNull() ? null : error.toString();
        JsonNode keys = root.get("keys");
        if (keys == null || !keys.isArray()) {
            return new Document(null, errorText);
        }
        return new Document(readKeys(keys), errorText);
    }

    // a malformed entry is skipped so the remaining keys stay usable
    private static List<JsonWebKey> readKeys(JsonNode keys) {
        var result = new ArrayList<JsonWebKey>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            JsonNode entry = keys.get(i);
            if (entry.isNull()) {
                continue;
            }
            try {
                result.add(MAPPER.convertValue(entry, JsonWebKey.class));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping malformed JWK set entry [index: {}, kid: {}]: {}",
                        i, entry.path("kid").asText(null), e.getMessage());
            }
        }
        return List.copyOf(result);
    }

    /** Serializes a key list for storage in the cache. */
    public static String encodeKeys(List<JsonWebKey> keys) {
        try {
            return MAPPER.writeValueAsString(keys);
        } catch (JsonProcessingException e) {
            throw new JwkSetFormatException("Failed to serialize key set", e);
        }
    }

    /**
     * Reads a key list previously written by {@link #encodeKeys}.
     *
     * @throws JwkSetFormatException if the value is not a JSON array of keys
     */
    public static List<JsonWebKey> decodeKeys(String json) {
        try {
            List<JsonWebKey> keys = MAPPER.readValue(json, KEY_LIST);
            if (keys == null) {
                throw new JwkSetFormatException("Cached key set is null", null);
            }
            return withoutNulls(keys);
        } catch (JsonProcessingException e) {
            throw new JwkSetFormatException("Cached key set is not a JSON array of keys", e);
        }
    }

    // JSON null entries carry no key material
    private static List<JsonWebKey> withoutNulls(List<JsonWebKey> keys) {
        return keys.stream().filter(Objects::nonNull).toList();
    }

    /**
     * Thrown when a JWK set document or cached key list cannot be mapped.
     */
    public static class JwkSetFormatException extends RuntimeException {
        public JwkSetFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
