package com.idgate.auth;

import com.idgate.keys.JsonWebKey;
import com.idgate.keys.KeyImportException;
import com.idgate.keys.KeyValueCache;
import com.idgate.keys.ProviderKeyCache;
import com.idgate.keys.SignatureVerifier;
import com.idgate.observability.ClaimRedactor;
import com.idgate.observability.VerificationMetrics;
import com.idgate.token.ClaimMap;
import com.idgate.token.ClaimPredicate;
import com.idgate.token.ClaimValidationResult;
import com.idgate.token.ClaimValidator;
import com.idgate.token.DecodedToken;
import com.idgate.token.MalformedTokenException;
import com.idgate.token.TokenDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Verifies Firebase ID tokens.
 * <p>
 * A token is decoded, its payload is checked against {@link StandardClaimChecks#payload}, its
 * header against {@link StandardClaimChecks#header}, and its payload against the caller's own
 * checks. Only then is the provider key named by {@code kid} resolved and the RS256 signature
 * verified. The first failing step rejects the token; nothing is retried.
 * <p>
 * {@link #authenticate} never throws for a bad token. Every failure, including unexpected ones,
 * becomes an empty result; {@link #verify} exposes the {@link RejectionReason} for diagnostics.
 * Raw tokens are never logged and claims are redacted before logging.
 * <p>
 * Instances are immutable and thread-safe. The only shared state is the caller's cache.
 */
public final class FirebaseAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(FirebaseAuthenticator.class);

    private final ProviderKeyCache keyCache;
    private final SignatureVerifier signatureVerifier;
    private final VerificationMetrics metrics;
    private final ClaimRedactor redactor;
    private final Clock clock;

    public FirebaseAuthenticator(ProviderKeyCache keyCache) {
        this(keyCache, new SignatureVerifier(), VerificationMetrics.noop(), new ClaimRedactor(),
                Clock.systemUTC());
    }

    /**
     * @param keyCache          resolves provider keys by {@code kid}
     * @param signatureVerifier checks RS256 signatures
     * @param metrics           records outcomes and durations
     * @param redactor          masks personal claims in rejection logs
     * @param clock             source of "now" for the time-based claim checks
     */
    public FirebaseAuthenticator(ProviderKeyCache keyCache, SignatureVerifier signatureVerifier,
                                 VerificationMetrics metrics, ClaimRedactor redactor, Clock clock) {
        this.keyCache = Objects.requireNonNull(keyCache, "keyCache");
        this.signatureVerifier = Objects.requireNonNull(signatureVerifier, "signatureVerifier");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.redactor = Objects.requireNonNull(redactor, "redactor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Authenticates a token with only the standard checks.
     *
     * @see #authenticate(String, KeyValueCache, String, List)
     */
    public Optional<ClaimMap> authenticate(String projectId, KeyValueCache cache, String token) {
        return authenticate(projectId, cache, token, List.of());
    }

    /**
     * Authenticates a token.
     *
     * @param projectId   the Firebase project the token must be issued for
     * @param cache       cache holding the provider key set
     * @param token       the compact token text
     * @param extraChecks additional payload checks; an empty list adds none
     * @return the payload claims if the token is valid, otherwise empty
     */
    public Optional<ClaimMap> authenticate(String projectId, KeyValueCache cache, String token,
                                           List<? extends ClaimPredicate> extraChecks) {
        return verify(projectId, cache, token, extraChecks).claims();
    }

    /**
     * Runs the same pipeline as {@link #authenticate} and returns the structured outcome.
     * A null or blank {@code projectId} or a null {@code cache} is rejected as
     * {@link RejectionReason#INTERNAL_ERROR}.
     */
    public VerificationOutcome verify(String projectId, KeyValueCache cache, String token,
                                      List<? extends ClaimPredicate> extraChecks) {
        List<? extends ClaimPredicate> checks = extraChecks == null ? List.of() : extraChecks;

        long started = System.nanoTime();
        DecodedToken decoded = null;
        VerificationOutcome outcome;
        try {
            if (projectId == null || projectId.isBlank()) {
                throw new IllegalArgumentException("projectId must not be null or blank");
            }
            Objects.requireNonNull(cache, "cache");
            if (token == null || token.isEmpty()) {
                outcome = VerificationOutcome.rejected(RejectionReason.MISSING_TOKEN, "no token supplied");
            } else {
                decoded = TokenDecoder.decode(token);
                outcome = verifyDecoded(projectId, cache, decoded, checks);
            }
        } catch (MalformedTokenException e) {
            outcome = VerificationOutcome.rejected(RejectionReason.MALFORMED_TOKEN, e.getMessage());
        } catch (KeyImportException e) {
            log.error("Provider key could not be imported [kid: {}]", e.keyId(), e);
            outcome = VerificationOutcome.rejected(RejectionReason.KEY_IMPORT_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure while verifying token [project: {}]", projectId, e);
            outcome = VerificationOutcome.rejected(RejectionReason.INTERNAL_ERROR,
                    e.getClass().getSimpleName());
        }

        report(outcome, decoded, Duration.ofNanos(System.nanoTime() - started));
        return outcome;
    }

    private VerificationOutcome verifyDecoded(String projectId, KeyValueCache cache,
                                              DecodedToken decoded,
                                              List<? extends ClaimPredicate> checks) {
        ClaimValidationResult standard =
                ClaimValidator.check(decoded.payload(), StandardClaimChecks.payload(projectId, clock));
        if (!standard.valid()) {
            return claimFailure("payload", standard);
        }
        ClaimValidationResult header = ClaimValidator.check(decoded.header(), StandardClaimChecks.header());
        if (!header.valid()) {
            return claimFailure("header", header);
        }
        ClaimValidationResult caller = ClaimValidator.check(decoded.payload(), checks);
        if (!caller.valid()) {
            return claimFailure("caller", caller);
        }

        Optional<String> kid = decoded.header().keyId();
        if (kid.isEmpty()) {
            return VerificationOutcome.rejected(RejectionReason.KEY_NOT_FOUND, "token header has no kid");
        }
        Optional<JsonWebKey> key = keyCache.getProviderKey(cache, kid.get());
        if (key.isEmpty()) {
            return VerificationOutcome.rejected(RejectionReason.KEY_NOT_FOUND,
                    "no provider key [kid: %s]".formatted(kid.get()));
        }
        if (!signatureVerifier.verify(key.get(), decoded)) {
            return VerificationOutcome.rejected(RejectionReason.SIGNATURE_INVALID,
                    "signature does not match [kid: %s]".formatted(kid.get()));
        }
        return VerificationOutcome.authenticated(decoded.payload());
    }

    private static VerificationOutcome claimFailure(String stage, ClaimValidationResult result) {
        return VerificationOutcome.rejected(RejectionReason.CLAIM_VALIDATION_FAILED,
                "%s checks failed: %s".formatted(stage, result.failedChecks()));
    }

    private void report(VerificationOutcome outcome, DecodedToken decoded, Duration elapsed) {
        if (outcome instanceof VerificationOutcome.Authenticated authenticated) {
            log.debug("Token accepted [sub: {}]", authenticated.payload().subject().orElse(null));
            metrics.recordAuthenticated(elapsed);
        } else if (outcome instanceof VerificationOutcome.Rejected rejected) {
            if (decoded == null) {
                log.info("Token rejected [reason: {}, detail: {}]", rejected.reason(), rejected.detail());
            } else {
                log.info("Token rejected [reason: {}, detail: {}, header: {}, claims: {}]",
                        rejected.reason(), rejected.detail(),
                        redactor.redact(decoded.header().asMap()),
                        redactor.redact(decoded.payload().asMap()));
            }
            metrics.recordRejected(rejected.reason().name(), elapsed);
        }
    }
}
