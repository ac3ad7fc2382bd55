package com.idgate.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, schema-less view of the claims in a token header or payload.
 * <p>
 * Values are whatever the JSON parser produced: {@code String}, {@code Number},
 * {@code Boolean}, {@code List}, {@code Map} or {@code null}. The typed accessors return
 * empty when a claim is absent or has a different type, so callers never need to catch
 * a {@link ClassCastException}.
 */
public final class ClaimMap {

    /** Subject claim. For Firebase tokens this is the user's uid. */
    public static final String SUBJECT = "sub";
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String EXPIRES_AT = "exp";
    public static final String ISSUED_AT = "iat";
    public static final String AUTH_TIME = "auth_time";

    /** Header parameter naming the signing algorithm. */
    public static final String ALGORITHM = "alg";

    /** Header parameter naming the signing key. */
    public static final String KEY_ID = "kid";

    private static final ClaimMap EMPTY = new ClaimMap(Map.of());

    private final Map<String, Object> claims;

    private ClaimMap(Map<String, Object> claims) {
        this.claims = claims;
    }

    /**
     * Creates a claim map holding a copy of the given entries. {@code null} values are kept.
     */
    public static ClaimMap of(Map<String, ?> claims) {
        if (claims == null || claims.isEmpty()) {
            return EMPTY;
        }
        return new ClaimMap(Collections.unmodifiableMap(new LinkedHashMap<>(claims)));
    }

    /** Returns an empty claim map. */
    public static ClaimMap empty() {
        return EMPTY;
    }

    /** Returns the raw value of a claim, or empty if absent or JSON {@code null}. */
    public Optional<Object> get(String key) {
        return Optional.ofNullable(claims.get(key));
    }

    /** Returns a claim's value if it is a string. */
    public Optional<String> getString(String key) {
        return claims.get(key) instanceof String s ? Optional.of(s) : Optional.empty();
    }

    /** Returns a claim's value if it is a number. */
    public Optional<Number> getNumber(String key) {
        return claims.get(key) instanceof Number n ? Optional.of(n) : Optional.empty();
    }

    /** Returns a claim's value if it is a boolean. */
    public Optional<Boolean> getBoolean(String key) {
        return claims.get(key) instanceof Boolean b ? Optional.of(b) : Optional.empty();
    }

    public boolean contains(String key) {
        return claims.containsKey(key);
    }

    public Set<String> names() {
        return claims.keySet();
    }

    public int size() {
        return claims.size();
    }

    public boolean isEmpty() {
        return claims.isEmpty();
    }

    /** Returns the claims as an unmodifiable map. */
    public Map<String, Object> asMap() {
        return claims;
    }

    public Optional<String> subject() {
        return getString(SUBJECT);
    }

    public Optional<String> issuer() {
        return getString(ISSUER);
    }

    public Optional<String> audience() {
        return getString(AUDIENCE);
    }

    public Optional<Long> expiresAt() {
        return getNumber(EXPIRES_AT).map(Number::longValue);
    }

    public Optional<Long> issuedAt() {
        return getNumber(ISSUED_AT).map(Number::longValue);
    }

    public Optional<Long> authTime() {
        return getNumber(AUTH_TIME).map(Number::longValue);
    }

    public Optional<String> algorithm() {
        return getString(ALGORITHM);
    }

    public Optional<String> keyId() {
        return getString(KEY_ID);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClaimMap other && claims.equals(other.claims);
    }

    @Override
    public int hashCode() {
        return claims.hashCode();
    }

    @Override
    public String toString() {
        return "ClaimMap" + claims;
    }
}
