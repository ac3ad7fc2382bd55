package com.idgate.token;

import java.util.List;

/**
 * Result of checking a {@link ClaimMap} against a list of predicates.
 *
 * @param valid        true if every predicate held
 * @param failedChecks descriptions of the predicates that did not hold (empty when valid)
 */
public record ClaimValidationResult(boolean valid, List<String> failedChecks) {

    /** Convenience factory for a passing result. */
    public static ClaimValidationResult ok() {
        return new ClaimValidationResult(true, List.of());
    }

    /** Convenience factory for a failing result. */
    public static ClaimValidationResult fail(List<String> failedChecks) {
        return new ClaimValidationResult(false, List.copyOf(failedChecks));
    }
}
