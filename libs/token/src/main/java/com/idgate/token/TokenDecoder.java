package com.idgate.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Map;

/**
 * Decodes compact tokens ({@code header.payload.signature}) without verifying them.
 * <p>
 * Header and payload are parsed with Jackson into {@link ClaimMap}s. The payload bytes are
 * read as UTF-8 so non-ASCII claim values (names, emails) survive decoding.
 */
public final class TokenDecoder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final TypeReference<Map<String, Object>> CLAIMS_TYPE = new TypeReference<>() {};

    private TokenDecoder() {
        // utility class
    }

    /**
     * Splits and decodes a compact token.
     *
     * @param token the compact token text
     * @return the decoded token, retaining the raw header and payload segments
     * @throws MalformedTokenException if the token does not have exactly three segments or a
     *                                 segment cannot be decoded
     */
    public static DecodedToken decode(String token) {
        if (token == null) {
            throw new MalformedTokenException("token must not be null");
        }
        // limit -1 keeps trailing empty segments so "a.b." counts as three parts
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) {
            throw new MalformedTokenException(
                    "Expected 3 token segments but found %d".formatted(parts.length));
        }

        ClaimMap header = parseSegment(parts[0], "header");
        ClaimMap payload = parseSegment(parts[1], "payload");
        byte[] signature;
        try {
            signature = Base64Url.decode(parts[2]);
        } catch (Base64Url.IllegalBase64UrlException e) {
            throw new MalformedTokenException("Token signature is not valid base64url", e);
        }
        return new DecodedToken(header, payload, signature, parts[0], parts[1]);
    }

    private static ClaimMap parseSegment(String segment, String name) {
        byte[] json;
        try {
            json = Base64Url.decode(segment);
        } catch (Base64Url.IllegalBase64UrlException e) {
            throw new MalformedTokenException("Token " + name + " is not valid base64url", e);
        }
        try {
            Map<String, Object> claims = MAPPER.readValue(json, CLAIMS_TYPE);
            if (claims == null) {
                throw new MalformedTokenException("Token " + name + " is not a JSON object");
            }
            return ClaimMap.of(claims);
        } catch (JsonProcessingException e) {
            throw new MalformedTokenException("Token " + name + " is not a JSON object", e);
        } catch (IOException e) {
            throw new MalformedTokenException("Failed to read token " + name, e);
        }
    }
}
