package com.idgate.token;

/**
 * A side-effect-free check over a {@link ClaimMap}.
 * <p>
 * A predicate must return {@code false}, never throw, when the claim it looks at is missing
 * or has an unexpected type. Standard predicates are created through {@link ClaimPredicates};
 * callers may supply any lambda for their own checks:
 *
 * <pre>{@code
 * ClaimPredicate verifiedEmail = claims -> claims.getBoolean("email_verified").orElse(false);
 * }</pre>
 */
@FunctionalInterface
public interface ClaimPredicate {

    /**
     * Evaluates this predicate.
     *
     * @param claims the claims to inspect
     * @return true if the claims satisfy the predicate
     */
    boolean evaluate(ClaimMap claims);

    /** Human-readable description used in diagnostics. */
    default String describe() {
        return "custom check";
    }
}
