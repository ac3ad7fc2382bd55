package com.idgate.auth;

import com.idgate.token.ClaimMap;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of running a token through {@link FirebaseAuthenticator}.
 */
public sealed interface VerificationOutcome
        permits VerificationOutcome.Authenticated, VerificationOutcome.Rejected {

    /** The verified payload claims, or empty for a rejection. */
    Optional<ClaimMap> claims();

    default boolean isAuthenticated() {
        return this instanceof Authenticated;
    }

    static VerificationOutcome authenticated(ClaimMap claims) {
        return new Authenticated(claims);
    }

    static VerificationOutcome rejected(RejectionReason reason, String detail) {
        return new Rejected(reason, detail);
    }

    /**
     * @param payload the token's payload claims
     */
    record Authenticated(ClaimMap payload) implements VerificationOutcome {

        public Authenticated {
            Objects.requireNonNull(payload, "payload");
        }

        @Override
        public Optional<ClaimMap> claims() {
            return Optional.of(payload);
        }
    }

    /**
     * @param reason why the token was rejected
     * @param detail diagnostic text for logs; never contains the raw token
     */
    record Rejected(RejectionReason reason, String detail) implements VerificationOutcome {

        public Rejected {
            Objects.requireNonNull(reason, "reason");
            detail = detail == null ? "" : detail;
        }

        @Override
        public Optional<ClaimMap> claims() {
            return Optional.empty();
        }
    }
}
