package com.idgate.auth.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.idgate.auth.FirebaseAuthenticator;
import com.idgate.auth.ProjectAuthenticator;
import com.idgate.keys.HttpJwkSetFetcher;
import com.idgate.keys.InMemoryKeyValueCache;
import com.idgate.keys.JwkSetFetcher;
import com.idgate.keys.KeyValueCache;
import com.idgate.keys.ProviderKeyCache;
import com.idgate.keys.SignatureVerifier;
import com.idgate.observability.ClaimRedactor;
import com.idgate.observability.VerificationMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires Firebase ID token verification into a Spring Boot application.
 *
 * <p>Active only when {@code idgate.auth.enabled=true}. Every bean except the authenticators
 * backs off when the application defines its own, so a service can plug in a shared
 * {@link KeyValueCache} or a different {@link JwkSetFetcher}.
 *
 * <p>Metrics go to the application's {@link MeterRegistry} when there is one and are dropped
 * otherwise.
 *
 * @see IdGateAuthProperties
 */
@Configuration
@EnableConfigurationProperties(IdGateAuthProperties.class)
@ConditionalOnProperty(prefix = "idgate.auth", name = "enabled", havingValue = "true")
public class IdGateAuthConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JwkSetFetcher jwkSetFetcher(IdGateAuthProperties properties) {
        return new HttpJwkSetFetcher(properties.jwksUri(), properties.fetchTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueCache keyValueCache(IdGateAuthProperties properties) {
        return new InMemoryKeyValueCache(properties.defaultCacheTtl(), Ticker.systemTicker());
    }

    @Bean
    @ConditionalOnMissingBean
    public VerificationMetrics verificationMetrics(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        return meterRegistry == null ? VerificationMetrics.noop() : new VerificationMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ProviderKeyCache providerKeyCache(JwkSetFetcher fetcher, IdGateAuthProperties properties,
                                             VerificationMetrics metrics) {
        return new ProviderKeyCache(fetcher, properties.cacheKey(), properties.ttlSafetyMargin(), metrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public SignatureVerifier signatureVerifier() {
        return new SignatureVerifier();
    }

    @Bean
    public FirebaseAuthenticator firebaseAuthenticator(ProviderKeyCache keyCache,
                                                       SignatureVerifier signatureVerifier,
                                                       VerificationMetrics metrics) {
        return new FirebaseAuthenticator(keyCache, signatureVerifier, metrics, new ClaimRedactor(),
                Clock.systemUTC());
    }

    @Bean
    public ProjectAuthenticator projectAuthenticator(FirebaseAuthenticator authenticator,
                                                     KeyValueCache keyValueCache,
                                                     IdGateAuthProperties properties) {
        return new ProjectAuthenticator(authenticator, properties.projectId(), keyValueCache);
    }
}
