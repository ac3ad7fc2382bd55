package com.idgate.auth;

import com.idgate.keys.CacheControl;
import com.idgate.keys.InMemoryKeyValueCache;
import com.idgate.keys.JsonWebKey;
import com.idgate.keys.KeyValueCache;
import com.idgate.keys.ProviderKeyCache;
import com.idgate.keys.SignatureVerifier;
import com.idgate.keys.testing.StubJwkSetFetcher;
import com.idgate.keys.testing.TestTokens;
import com.idgate.observability.ClaimRedactor;
import com.idgate.observability.VerificationMetrics;
import com.idgate.token.ClaimMap;
import com.idgate.token.ClaimPredicate;
import com.idgate.token.ClaimPredicates;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("FirebaseAuthenticator")
class FirebaseAuthenticatorTest {

    private static final String PROJECT = "demo-project";
    private static final long NOW = 1_700_000_000L;

    private static TestTokens signer;

    private StubJwkSetFetcher fetcher;
    private SimpleMeterRegistry registry;
    private FirebaseAuthenticator authenticator;
    private InMemoryKeyValueCache cache;

    @BeforeAll
    static void createSigner() {
        signer = TestTokens.create();
    }

    @BeforeEach
    void setUp() {
        fetcher = new StubJwkSetFetcher().respondWith(List.of(signer.jwk()), "public, max-age=21600");
        registry = new SimpleMeterRegistry();
        var metrics = new VerificationMetrics(registry);
        var keyCache = new ProviderKeyCache(fetcher, ProviderKeyCache.DEFAULT_CACHE_KEY,
                CacheControl.DEFAULT_SAFETY_MARGIN, metrics);
        authenticator = new FirebaseAuthenticator(keyCache, new SignatureVerifier(), metrics,
                new ClaimRedactor(), Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC));
        cache = new InMemoryKeyValueCache();
    }

    private Map<String, Object> claims() {
        return TestTokens.firebaseClaims(PROJECT, NOW);
    }

    private VerificationOutcome verify(String token) {
        return authenticator.verify(PROJECT, cache, token, List.of());
    }

    private static RejectionReason reasonOf(VerificationOutcome outcome) {
        assertThat(outcome).isInstanceOf(VerificationOutcome.Rejected.class);
        return ((VerificationOutcome.Rejected) outcome).reason();
    }

    @Nested
    @DisplayName("valid tokens")
    class ValidTokens {

        @Test
        @DisplayName("returns the payload claims")
        void returnsClaims() {
            Optional<ClaimMap> result = authenticator.authenticate(PROJECT, cache,
                    signer.signFirebaseToken(PROJECT, NOW));

            assertThat(result).isPresent();
            assertThat(result.get().subject()).contains("uid-123");
            assertThat(result.get().audience()).contains(PROJECT);
            assertThat(result.get().getString("email")).contains("ada@example.com");
        }

        @Test
        @DisplayName("an empty list of extra checks never blocks authentication")
        void emptyExtraChecks() {
            assertThat(authenticator.authenticate(PROJECT, cache, signer.signFirebaseToken(PROJECT, NOW), List.of()))
                    .isPresent();
        }

        @Test
        @DisplayName("passing extra checks keep the token valid")
        void passingExtraChecks() {
            var checks = List.of(ClaimPredicates.equalTo("email_verified", true));

            assertThat(authenticator.authenticate(PROJECT, cache, signer.signFirebaseToken(PROJECT, NOW), checks))
                    .isPresent();
        }

        @Test
        @DisplayName("fetches the key set once across calls")
        void fetchesOnce() {
            authenticator.authenticate(PROJECT, cache, signer.signFirebaseToken(PROJECT, NOW));
            authenticator.authenticate(PROJECT, cache, signer.signFirebaseToken(PROJECT, NOW));

            assertThat(fetcher.fetchCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("claim checks")
    class ClaimChecks {

        @Test
        @DisplayName("rejects an expired token even with a valid signature")
        void expired() {
            var payload = claims();
            payload.put("exp", NOW - 1);

            VerificationOutcome outcome = verify(signer.sign(payload));

            assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
            assertThat(((VerificationOutcome.Rejected) outcome).detail()).contains("exp is in the future");
        }

        @Test
        @DisplayName("rejects a token expiring exactly now")
        void expiresNow() {
            var payload = claims();
            payload.put("exp", NOW);

            assertThat(reasonOf(verify(signer.sign(payload)))).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects a token for another project")
        void wrongAudience() {
            var payload = claims();
            payload.put("aud", "other-project");

            assertThat(authenticator.authenticate(PROJECT, cache, signer.sign(payload))).isEmpty();
        }

        @Test
        @DisplayName("rejects a token from another issuer")
        void wrongIssuer() {
            var payload = claims();
            payload.put("iss", "https://accounts.example.com");

            assertThat(reasonOf(verify(signer.sign(payload)))).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects an empty subject")
        void emptySubject() {
            var payload = claims();
            payload.put("sub", "");

            assertThat(reasonOf(verify(signer.sign(payload)))).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects an auth_time in the future")
        void futureAuthTime() {
            var payload = claims();
            payload.put("auth_time", NOW + 60);

            assertThat(reasonOf(verify(signer.sign(payload)))).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects a token without iat")
        void missingIssuedAt() {
            var payload = claims();
            payload.remove("iat");

            assertThat(reasonOf(verify(signer.sign(payload)))).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
        }

        @Test
        @DisplayName("rejects a non-RS256 algorithm before fetching any key")
        void wrongAlgorithm() {
            var header = signer.header();
            header.put("alg", "HS256");

            VerificationOutcome outcome = verify(signer.sign(header, claims()));

            assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
            assertThat(((VerificationOutcome.Rejected) outcome).detail()).contains("header");
            assertThat(fetcher.fetchCount()).isZero();
        }

        @Test
        @DisplayName("rejects when a caller check fails, before fetching any key")
        void failingExtraCheck() {
            ClaimPredicate alwaysFalse = claims -> false;

            VerificationOutcome outcome = authenticator.verify(PROJECT, cache,
                    signer.signFirebaseToken(PROJECT, NOW), List.of(alwaysFalse));

            assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.CLAIM_VALIDATION_FAILED);
            assertThat(((VerificationOutcome.Rejected) outcome).detail()).contains("custom check");
            assertThat(fetcher.fetchCount()).isZero();
        }
    }

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @ParameterizedTest
        @ValueSource(strings = {"a.b", "a.b.c.d", "abc", "abc.def.ghi", "..."})
        @DisplayName("rejects tokens that cannot be decoded")
        void malformed(String token) {
            assertThat(reasonOf(verify(token))).isEqualTo(RejectionReason.MALFORMED_TOKEN);
            assertThat(authenticator.authenticate(PROJECT, cache, token)).isEmpty();
        }

        @Test
        @DisplayName("rejects a null or empty token as missing")
        void missing() {
            assertThat(reasonOf(verify(null))).isEqualTo(RejectionReason.MISSING_TOKEN);
            assertThat(reasonOf(verify(""))).isEqualTo(RejectionReason.MISSING_TOKEN);
        }

        @Test
        @DisplayName("rejects a blank project id without throwing")
        void blankProject() {
            String token = signer.signFirebaseToken(PROJECT, NOW);

            assertThatCode(() -> authenticator.authenticate(" ", cache, token)).doesNotThrowAnyException();
            assertThat(authenticator.authenticate("", cache, token)).isEmpty();
            assertThat(reasonOf(authenticator.verify(null, cache, token, List.of())))
                    .isEqualTo(RejectionReason.INTERNAL_ERROR);
            assertThat(fetcher.fetchCount()).isZero();
        }

        @Test
        @DisplayName("rejects a missing cache without throwing")
        void missingCache() {
            String token = signer.signFirebaseToken(PROJECT, NOW);

            assertThatCode(() -> authenticator.authenticate(PROJECT, null, token)).doesNotThrowAnyException();
            assertThat(authenticator.authenticate(PROJECT, null, token)).isEmpty();
            assertThat(reasonOf(authenticator.verify(PROJECT, null, token, List.of())))
                    .isEqualTo(RejectionReason.INTERNAL_ERROR);
        }
    }

    @Nested
    @DisplayName("keys and signatures")
    class KeysAndSignatures {

        @Test
        @DisplayName("rejects a payload altered after signing")
        void alteredPayload() {
            var altered = claims();
            altered.put("email", "mallory@example.com");
            String[] original = signer.sign(claims()).split("\\.");
            String[] forged = signer.sign(altered).split("\\.");
            String spliced = original[0] + "." + forged[1] + "." + original[2];

            assertThat(reasonOf(verify(spliced))).isEqualTo(RejectionReason.SIGNATURE_INVALID);
        }

        @Test
        @DisplayName("rejects a token signed by a different key under the same kid")
        void foreignKey() {
            TestTokens impostor = TestTokens.create(signer.kid());

            assertThat(reasonOf(verify(impostor.signFirebaseToken(PROJECT, NOW))))
                    .isEqualTo(RejectionReason.SIGNATURE_INVALID);
        }

        @Test
        @DisplayName("rejects an unknown kid")
        void unknownKid() {
            var header = signer.header();
            header.put("kid", "rotated-away");

            assertThat(reasonOf(verify(signer.sign(header, claims())))).isEqualTo(RejectionReason.KEY_NOT_FOUND);
        }

        @Test
        @DisplayName("rejects a header without kid")
        void missingKid() {
            var header = signer.header();
            header.remove("kid");

            VerificationOutcome outcome = verify(signer.sign(header, claims()));

            assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.KEY_NOT_FOUND);
            assertThat(fetcher.fetchCount()).isZero();
        }

        @Test
        @DisplayName("rejects when the key set cannot be fetched")
        void fetchFailure() {
            fetcher.failWith("connection refused");

            assertThat(reasonOf(verify(signer.signFirebaseToken(PROJECT, NOW))))
                    .isEqualTo(RejectionReason.KEY_NOT_FOUND);
        }

        @Test
        @DisplayName("rejects when the provider key cannot be imported")
        void badKeyMaterial() {
            fetcher.respondWith(List.of(new JsonWebKey(signer.kid(), "EC", "ES256", "sig", null, null)), null);

            assertThat(reasonOf(verify(signer.signFirebaseToken(PROJECT, NOW))))
                    .isEqualTo(RejectionReason.KEY_IMPORT_FAILED);
        }

        @Test
        @DisplayName("turns an unexpected failure into a rejection")
        void unexpectedFailure() {
            KeyValueCache broken = mock(KeyValueCache.class);
            when(broken.get(anyString())).thenThrow(new IllegalStateException("cache offline"));

            VerificationOutcome outcome = authenticator.verify(PROJECT, broken,
                    signer.signFirebaseToken(PROJECT, NOW), List.of());

            assertThat(reasonOf(outcome)).isEqualTo(RejectionReason.INTERNAL_ERROR);
            assertThat(outcome.claims()).isEmpty();
        }
    }

    @Nested
    @DisplayName("metrics")
    class Metrics {

        @Test
        @DisplayName("counts authenticated tokens")
        void countsAuthenticated() {
            authenticator.authenticate(PROJECT, cache, signer.signFirebaseToken(PROJECT, NOW));

            assertThat(registry.get(VerificationMetrics.VERIFICATIONS)
                    .tag("outcome", "authenticated").counter().count()).isEqualTo(1.0);
            assertThat(registry.get(VerificationMetrics.VERIFICATION_DURATION)
                    .tag("outcome", "authenticated").timer().count()).isEqualTo(1);
        }

        @Test
        @DisplayName("counts rejections by reason")
        void countsRejections() {
            authenticator.authenticate(PROJECT, cache, "a.b");
            authenticator.authenticate(PROJECT, cache, null);

            assertThat(registry.get(VerificationMetrics.VERIFICATIONS)
                    .tag("reason", "malformed_token").counter().count()).isEqualTo(1.0);
            assertThat(registry.get(VerificationMetrics.VERIFICATIONS)
                    .tag("reason", "missing_token").counter().count()).isEqualTo(1.0);
        }
    }
}
