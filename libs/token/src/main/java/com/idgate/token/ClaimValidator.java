package com.idgate.token;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates claim predicates against a {@link ClaimMap}.
 * <p>
 * A claim map is valid when every predicate holds; an empty predicate list is always valid.
 * Predicates are pure, so {@link #validate} may stop at the first failure while
 * {@link #check} evaluates all of them to report every failed check.
 */
public final class ClaimValidator {

    private ClaimValidator() {
        // utility class
    }

    /**
     * Returns true if all predicates hold for the claims.
     *
     * @param claims     the claims to validate
     * @param predicates the predicates to apply (may be empty)
     */
    public static boolean validate(ClaimMap claims, List<? extends ClaimPredicate> predicates) {
        for (ClaimPredicate predicate : predicates) {
            if (!predicate.evaluate(claims)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Evaluates every predicate and collects the descriptions of those that failed.
     *
     * @param claims     the claims to validate
     * @param predicates the predicates to apply (may be empty)
     * @return a {@link ClaimValidationResult} listing failed checks
     */
    public static ClaimValidationResult check(ClaimMap claims, List<? extends ClaimPredicate> predicates) {
        var failures = new ArrayList<String>();
        for (ClaimPredicate predicate : predicates) {
            if (!predicate.evaluate(claims)) {
                failures.add(predicate.describe());
            }
        }
        return failures.isEmpty() ? ClaimValidationResult.ok() : ClaimValidationResult.fail(failures);
    }
}
