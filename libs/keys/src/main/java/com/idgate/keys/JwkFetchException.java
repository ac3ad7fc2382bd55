package com.idgate.keys;

import java.net.URI;

/**
 * Thrown when the JWK set endpoint cannot be reached or returns an unreadable body.
 */
public class JwkFetchException extends RuntimeException {

    private final URI uri;

    public JwkFetchException(URI uri, String message, Throwable cause) {
        super("%s [uri: %s]".formatted(message, uri), cause);
        this.uri = uri;
    }

    public URI uri() {
        return uri;
    }
}
