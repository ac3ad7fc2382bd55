package com.idgate.keys;

import com.idgate.observability.VerificationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-through cache for the provider's public key set.
 * <p>
 * The full key list lives under one cache key. A cached list is trusted until it expires: if it
 * lacks the requested {@code kid} the lookup misses without refetching, so a freshly rotated key
 * is rejected until the cached list expires. On a cache miss the list is fetched once, stored
 * with a TTL of {@code max-age} minus a safety margin, and searched. Error responses and failed
 * fetches are never cached; a failed fetch yields no key for that call.
 */
public final class ProviderKeyCache {

    /** Cache key under which the provider key list is stored. */
    public static final String DEFAULT_CACHE_KEY = "google_pk";

    static final String SOURCE_CACHE = "cache";
    static final String SOURCE_NETWORK = "network";
    static final String SOURCE_UNAVAILABLE = "unavailable";

    private static final Logger log = LoggerFactory.getLogger(ProviderKeyCache.class);

    private final JwkSetFetcher fetcher;
    private final String cacheKey;
    private final Duration safetyMargin;
    private final VerificationMetrics metrics;

    public ProviderKeyCache(JwkSetFetcher fetcher) {
        this(fetcher, DEFAULT_CACHE_KEY, CacheControl.DEFAULT_SAFETY_MARGIN, VerificationMetrics.noop());
    }

    /**
     * @param fetcher      fetches the key set on a cache miss
     * @param cacheKey     cache key for the key list
     * @param safetyMargin subtracted from the response's max-age to get the TTL
     * @param metrics      records where lookups were answered from
     */
    public ProviderKeyCache(JwkSetFetcher fetcher, String cacheKey, Duration safetyMargin,
                            VerificationMetrics metrics) {
        if (cacheKey == null || cacheKey.isBlank()) {
            throw new IllegalArgumentException("cacheKey must not be null or blank");
        }
        if (safetyMargin == null || safetyMargin.isNegative()) {
            throw new IllegalArgumentException("safetyMargin must not be null or negative");
        }
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.cacheKey = cacheKey;
        this.safetyMargin = safetyMargin;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Finds the provider key with the given id.
     *
     * @param cache the caller's key-value cache
     * @param kid   the key id from the token header
     * @return the matching key, or empty if neither the cached nor a freshly fetched set has it
     */
    public Optional<JsonWebKey> getProviderKey(KeyValueCache cache, String kid) {
        Optional<List<JsonWebKey>> cached = readCached(cache);
        if (cached.isPresent()) {
            metrics.recordKeyLookup(SOURCE_CACHE);
            Optional<JsonWebKey> key = find(cached.get(), kid);
            if (key.isEmpty()) {
                log.debug("Cached key set has no key [kid: {}]", kid);
            }
            return key;
        }

        Optional<List<JsonWebKey>> fetched = fetchAndCache(cache);
        if (fetched.isEmpty()) {
            metrics.recordKeyLookup(SOURCE_UNAVAILABLE);
            return Optional.empty();
        }
        metrics.recordKeyLookup(SOURCE_NETWORK);
        return find(fetched.get(), kid);
    }

    private Optional<List<JsonWebKey>> readCached(KeyValueCache cache) {
        Optional<String> value = cache.get(cacheKey);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(JwkSetCodec.decodeKeys(value.get()));
        } catch (JwkSetCodec.JwkSetFormatException e) {
            log.warn("Ignoring unreadable cached key set [cache-key: {}]", cacheKey, e);
            return Optional.empty();
        }
    }

    private Optional<List<JsonWebKey>> fetchAndCache(KeyValueCache cache) {
        JwkSetResponse response;
        try {
            response = fetcher.fetch();
        } catch (JwkFetchException e) {
            log.warn("JWK set fetch failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
        if (!response.hasKeys()) {
            log.warn("JWK set response has no usable keys [status: {}, error: {}]",
                    response.statusCode(), response.error());
            return Optional.empty();
        }

        Duration ttl = CacheControl.ttl(response.cacheControl(), safetyMargin).orElse(null);
        cache.put(cacheKey, JwkSetCodec.encodeKeys(response.keys()), ttl);
        log.debug("Cached provider key set [keys: {}, ttl: {}]", response.keys().size(),
                ttl == null ? "default" : ttl);
        return Optional.of(response.keys());
    }

    private static Optional<JsonWebKey> find(List<JsonWebKey> keys, String kid) {
        return keys.stream().filter(key -> key.hasKeyId(kid)).findFirst();
    }

    public String cacheKey() {
        return cacheKey;
    }

    public Duration safetyMargin() {
        return safetyMargin;
    }
}
