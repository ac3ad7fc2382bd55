package com.idgate.keys;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * Fetches the JWK set with a single HTTP GET using the JDK {@link HttpClient}.
 * <p>
 * Non-2xx responses are returned with no keys so that callers do not cache them. The body of
 * a 2xx response is parsed with {@link JwkSetCodec}.
 */
public final class HttpJwkSetFetcher implements JwkSetFetcher {

    /** Google's JWK set for Firebase ID token signing keys. */
    public static final URI FIREBASE_JWKS_URI = URI.create(
            "https://www.googleapis.com/service_accounts/v1/jwk/securetoken@system.gserviceaccount.com");

    /** Default request timeout. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger log = LoggerFactory.getLogger(HttpJwkSetFetcher.class);

    private final HttpClient client;
    private final URI uri;
    private final Duration timeout;

    public HttpJwkSetFetcher() {
        this(FIREBASE_JWKS_URI, DEFAULT_TIMEOUT);
    }

    public HttpJwkSetFetcher(URI uri, Duration timeout) {
        this(HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), uri, timeout);
    }

    /**
     * @param client  the HTTP client to use
     * @param uri     the JWK set endpoint
     * @param timeout per-request timeout
     */
    public HttpJwkSetFetcher(HttpClient client, URI uri, Duration timeout) {
        this.client = Objects.requireNonNull(client, "client");
        this.uri = Objects.requireNonNull(uri, "uri");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public JwkSetResponse fetch() {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new JwkFetchException(uri, "Failed to fetch JWK set", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JwkFetchException(uri, "Interrupted while fetching JWK set", e);
        }

        String cacheControl = response.headers().firstValue("Cache-Control").orElse(null);
        int status = response.statusCode();
        log.debug("Fetched JWK set [uri: {}, status: {}, cache-control: {}]", uri, status, cacheControl);

        if (status < 200 || status >= 300) {
            return new JwkSetResponse(status, null, cacheControl, "HTTP " + status);
        }
        try {
            JwkSetCodec.Document document = JwkSetCodec.parseDocument(response.body());
            return new JwkSetResponse(status, document.keys(), cacheControl, document.error());
        } catch (JwkSetCodec.JwkSetFormatException e) {
            throw new JwkFetchException(uri, "Unreadable JWK set response", e);
        }
    }

    public URI uri() {
        return uri;
    }
}
