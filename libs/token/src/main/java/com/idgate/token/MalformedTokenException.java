package com.idgate.token;

/**
 * Thrown when a token is not a well-formed compact token: wrong number of segments,
 * invalid base64url, or a header/payload that is not a JSON object.
 */
public class MalformedTokenException extends RuntimeException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
