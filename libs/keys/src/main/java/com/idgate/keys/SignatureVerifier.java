package com.idgate.keys;

import com.idgate.token.Base64Url;
import com.idgate.token.DecodedToken;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.Signature;
import java.security.SignatureException;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.RSAPublicKeySpec;

/**
 * Verifies RS256 (RSASSA-PKCS1-v1_5 with SHA-256) signatures against a provider JWK.
 * <p>
 * An invalid signature is a {@code false} result, never an exception; only unusable key
 * material raises {@link KeyImportException}.
 */
public final class SignatureVerifier {

    /** JWS algorithm identifier this verifier implements. */
    public static final String ALGORITHM = "RS256";

    private static final String JCA_SIGNATURE = "SHA256withRSA";

    /**
     * Verifies a decoded token's signature over its raw header and payload segments.
     *
     * @param key   the provider key named by the token's {@code kid}
     * @param token the decoded token
     * @return true if the signature matches
     * @throws KeyImportException if the key cannot be imported
     */
    public boolean verify(JsonWebKey key, DecodedToken token) {
        return verify(key, token.signingInputBytes(), token.signature());
    }

    /**
     * Verifies a signature over the given bytes.
     *
     * @param key       the provider key
     * @param signed    exactly the bytes that were signed
     * @param signature the signature bytes
     * @return true if the signature matches
     * @throws KeyImportException if the key cannot be imported
     */
    public boolean verify(JsonWebKey key, byte[] signed, byte[] signature) {
        RSAPublicKey publicKey = importKey(key);
        try {
            Signature verifier = Signature.getInstance(JCA_SIGNATURE);
            verifier.initVerify(publicKey);
            verifier.update(signed);
            return verifier.verify(signature);
        } catch (SignatureException e) {
            // raised for signatures of the wrong length or encoding
            return false;
        } catch (InvalidKeyException e) {
            throw new KeyImportException(key.kid(), "Key rejected for RS256 verification", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(JCA_SIGNATURE + " is not available", e);
        }
    }

    /**
     * Builds an RSA public key from a JWK's modulus and exponent.
     *
     * @throws KeyImportException if the key is not a usable RSA key
     */
    public RSAPublicKey importKey(JsonWebKey key) {
        if (key == null) {
            throw new KeyImportException(null, "Key must not be null");
        }
        if (!JsonWebKey.KTY_RSA.equals(key.kty())) {
            throw new KeyImportException(key.kid(), "Unsupported key type '%s'".formatted(key.kty()));
        }
        if (key.n() == null || key.e() == null) {
            throw new KeyImportException(key.kid(), "RSA key is missing its modulus or exponent");
        }
        BigInteger modulus;
        BigInteger exponent;
        try {
            modulus = new BigInteger(1, Base64Url.decode(key.n()));
            exponent = new BigInteger(1, Base64Url.decode(key.e()));
        } catch (Base64Url.IllegalBase64UrlException e) {
            throw new KeyImportException(key.kid(), "RSA key material is not valid base64url", e);
        }
        if (modulus.signum() == 0 || exponent.signum() == 0) {
            throw new KeyImportException(key.kid(), "RSA key has an empty modulus or exponent");
        }
        try {
            return (RSAPublicKey) KeyFactory.getInstance(JsonWebKey.KTY_RSA)
                    .generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (InvalidKeySpecException e) {
            throw new KeyImportException(key.kid(), "RSA key spec rejected", e);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("RSA key factory is not available", e);
        }
    }
}
