package com.idgate.auth.config;

import com.idgate.keys.CacheControl;
import com.idgate.keys.HttpJwkSetFetcher;
import com.idgate.keys.InMemoryKeyValueCache;
import com.idgate.keys.ProviderKeyCache;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;
import java.time.Duration;

/**
 * Configuration for Firebase ID token verification, bound from {@code idgate.auth.*}.
 *
 * <pre>
 * idgate:
 *   auth:
 *     enabled: true
 *     project-id: my-firebase-project
 *     ttl-safety-margin: 120s
 *     fetch-timeout: 5s
 * </pre>
 *
 * <p>Only {@code project-id} is required; a context with auth enabled and no project id fails to
 * start.
 *
 * @param enabled         turns the auto-configuration on
 * @param projectId       Firebase project id; tokens must name it as audience and in the issuer
 * @param jwksUri         endpoint serving the provider's JWK set
 * @param cacheKey        cache key for the stored key set
 * @param ttlSafetyMargin subtracted from the JWK response's max-age
 * @param fetchTimeout    connect and request timeout for the JWK fetch
 * @param defaultCacheTtl TTL of the in-memory cache when the response has no usable max-age
 */
@ConfigurationProperties(prefix = "idgate.auth")
@Validated
public record IdGateAuthProperties(
        boolean enabled,
        @NotBlank String projectId,
        URI jwksUri,
        String cacheKey,
        Duration ttlSafetyMargin,
        Duration fetchTimeout,
        Duration defaultCacheTtl) {

    /** Applies defaults for optional fields. Runs before Bean Validation. */
    public IdGateAuthProperties {
        if (jwksUri == null) {
            jwksUri = HttpJwkSetFetcher.FIREBASE_JWKS_URI;
        }
        if (cacheKey == null || cacheKey.isBlank()) {
            cacheKey = ProviderKeyCache.DEFAULT_CACHE_KEY;
        }
        if (ttlSafetyMargin == null || ttlSafetyMargin.isNegative()) {
            ttlSafetyMargin = CacheControl.DEFAULT_SAFETY_MARGIN;
        }
        if (fetchTimeout == null || fetchTimeout.isZero() || fetchTimeout.isNegative()) {
            fetchTimeout = HttpJwkSetFetcher.DEFAULT_TIMEOUT;
        }
        if (defaultCacheTtl == null || defaultCacheTtl.isNegative()) {
            defaultCacheTtl = InMemoryKeyValueCache.DEFAULT_TTL;
        }
    }
}
