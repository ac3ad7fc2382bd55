package com.idgate.token;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Codec for the URL-safe, unpadded base64 alphabet used by compact tokens.
 * <p>
 * Decoding maps {@code -} to {@code +} and {@code _} to {@code /}, then restores the padding
 * from the input length: a remainder of 0 needs none, 2 needs {@code ==}, 3 needs {@code =}.
 * A remainder of 1 can never come from a valid encoding and aborts decoding.
 */
public final class Base64Url {

    private Base64Url() {
        // utility class
    }

    /**
     * Decodes base64url text into raw bytes.
     *
     * @param text the unpadded base64url text
     * @return the decoded bytes
     * @throws IllegalBase64UrlException if the length or alphabet is invalid
     */
    public static byte[] decode(String text) {
        if (text == null) {
            throw new IllegalBase64UrlException("base64url text must not be null");
        }
        String standard = text.replace('-', '+').replace('_', '/');
        String padded = switch (text.length() % 4) {
            case 0 -> standard;
            case 2 -> standard + "==";
            case 3 -> standard + "=";
            default -> throw new IllegalBase64UrlException(
                    "Illegal base64url length: %d".formatted(text.length()));
        };
        try {
            return Base64.getDecoder().decode(padded);
        } catch (IllegalArgumentException e) {
            throw new IllegalBase64UrlException("Illegal base64url text", e);
        }
    }

    /**
     * Decodes base64url text and interprets the bytes as UTF-8.
     *
     * @throws IllegalBase64UrlException if the text is not valid base64url
     */
    public static String decodeToString(String text) {
        return new String(decode(text), StandardCharsets.UTF_8);
    }

    /** Encodes bytes as unpadded base64url text. */
    public static String encode(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /** Encodes the UTF-8 bytes of a string as unpadded base64url text. */
    public static String encode(String text) {
        return encode(text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Thrown when text cannot be decoded as base64url.
     */
    public static class IllegalBase64UrlException extends RuntimeException {

        public IllegalBase64UrlException(String message) {
            super(message);
        }

        public IllegalBase64UrlException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
