package com.idgate.auth;

import com.idgate.keys.KeyValueCache;
import com.idgate.token.ClaimMap;
import com.idgate.token.ClaimPredicate;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@link FirebaseAuthenticator} bound to one project and one key cache, so callers only pass
 * the token.
 */
public final class ProjectAuthenticator {

    private final FirebaseAuthenticator authenticator;
    private final String projectId;
    private final KeyValueCache cache;

    public ProjectAuthenticator(FirebaseAuthenticator authenticator, String projectId, KeyValueCache cache) {
        if (projectId == null || projectId.isBlank()) {
            throw new IllegalArgumentException("projectId must not be null or blank");
        }
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
        this.projectId = projectId;
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    public Optional<ClaimMap> authenticate(String token) {
        return authenticator.authenticate(projectId, cache, token);
    }

    public Optional<ClaimMap> authenticate(String token, List<? extends ClaimPredicate> extraChecks) {
        return authenticator.authenticate(projectId, cache, token, extraChecks);
    }

    public VerificationOutcome verify(String token) {
        return authenticator.verify(projectId, cache, token, List.of());
    }

    public String projectId() {
        return projectId;
    }
}
