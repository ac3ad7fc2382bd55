package com.idgate.token;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * A compact token split into its parts.
 * <p>
 * The signature covers the header and payload segments exactly as they were transmitted,
 * so {@code rawHeader} and {@code rawPayload} hold the original base64url text. They must
 * not be rebuilt by re-encoding the decoded claims.
 * <p>
 * The signature array is copied in and out, and compared by content.
 *
 * @param header     decoded header parameters ({@code alg}, {@code kid}, ...)
 * @param payload    decoded payload claims
 * @param signature  raw signature bytes
 * @param rawHeader  header segment as received
 * @param rawPayload payload segment as received
 */
public record DecodedToken(
        ClaimMap header,
        ClaimMap payload,
        byte[] signature,
        String rawHeader,
        String rawPayload
) {

    public DecodedToken {
        signature = signature == null ? new byte[0] : signature.clone();
    }

    @Override
    public byte[] signature() {
        return signature.clone();
    }

    /** Returns the text the signature was computed over: {@code rawHeader + "." + rawPayload}. */
    public String signingInput() {
        return rawHeader + "." + rawPayload;
    }

    /** UTF-8 bytes of {@link #signingInput()}. */
    public byte[] signingInputBytes() {
        return signingInput().getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof DecodedToken other
                && Objects.equals(header, other.header)
                && Objects.equals(payload, other.payload)
                && Arrays.equals(signature, other.signature)
                && Objects.equals(rawHeader, other.rawHeader)
                && Objects.equals(rawPayload, other.rawPayload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(header, payload, rawHeader, rawPayload) + Arrays.hashCode(signature);
    }

    @Override
    public String toString() {
        return "DecodedToken[header=%s, payload=%s, signature=%d bytes]"
                .formatted(header, payload, signature.length);
    }
}
