package com.idgate.keys;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry of a JSON Web Key set (RFC 7517), restricted to the members needed for RSA
 * signature verification. Unknown members are ignored when reading.
 *
 * @param kid key id referenced by the token header
 * @param kty key type, {@code RSA} for the provider's keys
 * @param alg intended algorithm, e.g. {@code RS256} (optional)
 * @param use intended use, e.g. {@code sig} (optional)
 * @param n   RSA modulus, base64url unsigned big-endian
 * @param e   RSA public exponent, base64url unsigned big-endian
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonWebKey(
        String kid,
        String kty,
        String alg,
        String use,
        String n,
        String e
) {

    /** Key type value for RSA keys. */
    public static final String KTY_RSA = "RSA";

    /** Returns true if this key has the given key id. */
    public boolean hasKeyId(String keyId) {
        return kid != null && kid.equals(keyId);
    }
}
