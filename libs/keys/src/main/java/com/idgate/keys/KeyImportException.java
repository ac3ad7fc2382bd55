package com.idgate.keys;

/**
 * Thrown when a JWK cannot be turned into a public key: wrong key type, missing or
 * undecodable modulus/exponent, or a key spec the platform rejects.
 * <p>
 * This signals bad key material from the provider, not a bad token.
 */
public class KeyImportException extends RuntimeException {

    private final String keyId;

    public KeyImportException(String keyId, String message) {
        this(keyId, message, null);
    }

    public KeyImportException(String keyId, String message, Throwable cause) {
        super("%s [kid: %s]".formatted(message, keyId), cause);
        this.keyId = keyId;
    }

    public String keyId() {
        return keyId;
    }
}
