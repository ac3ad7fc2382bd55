package com.idgate.auth;

import com.idgate.keys.SignatureVerifier;
import com.idgate.token.ClaimMap;
import com.idgate.token.ClaimPredicate;
import com.idgate.token.ClaimPredicates;

import java.time.Clock;
import java.util.List;

/**
 * Claim checks every Firebase ID token must pass, in addition to whatever the caller adds.
 */
public final class StandardClaimChecks {

    /** Issuer prefix; the project id is appended. */
    public static final String ISSUER_PREFIX = "https://securetoken.google.com/";

    private StandardClaimChecks() {
        // utility class
    }

    public static String issuerFor(String projectId) {
        return ISSUER_PREFIX + projectId;
    }

    /**
     * Payload checks for the given project: unexpired, issued and authenticated in the past,
     * addressed to and issued for the project, with a non-empty subject.
     */
    public static List<ClaimPredicate> payload(String projectId, Clock clock) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be null or blank");
        }
        return List.of(
                ClaimPredicates.inFuture(ClaimMap.EXPIRES_AT, clock),
                ClaimPredicates.inPast(ClaimMap.ISSUED_AT, clock),
                ClaimPredicates.equalTo(ClaimMap.AUDIENCE, projectId),
                ClaimPredicates.equalTo(ClaimMap.ISSUER, issuerFor(projectId)),
                ClaimPredicates.notEmpty(ClaimMap.SUBJECT),
                ClaimPredicates.inPast(ClaimMap.AUTH_TIME, clock));
    }

    /** Header checks: the token must be signed with RS256. */
    public static List<ClaimPredicate> header() {
        return List.of(ClaimPredicates.equalTo(ClaimMap.ALGORITHM, SignatureVerifier.ALGORITHM));
    }
}
