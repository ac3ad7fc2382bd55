package com.idgate.keys;

import java.util.List;

/**
 * What a JWK set fetch returned.
 *
 * @param statusCode   HTTP status of the response
 * @param keys         the {@code keys} array, or {@code null} if the response carried none
 * @param cacheControl the {@code Cache-Control} header, or {@code null}
 * @param error        error detail from the body or status line, or {@code null}
 */
public record JwkSetResponse(int statusCode, List<JsonWebKey> keys, String cacheControl, String error) {

    public JwkSetResponse {
        keys = keys == null ? null : List.copyOf(keys);
    }

    /** A successful response carrying the given keys. */
    public static JwkSetResponse of(List<JsonWebKey> keys, String cacheControl) {
        return new JwkSetResponse(200, keys, cacheControl, null);
    }

    /**
     * Returns true if this response holds a key list that may be used and cached: a 2xx
     * status, a {@code keys} array and no {@code error} member.
     */
    public boolean hasKeys() {
        return statusCode >= 200 && statusCode < 300 && keys != null && error == null;
    }
}
