package com.idgate.token;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Objects;

/**
 * Factories for the standard claim predicates.
 * <p>
 * Time-based predicates compare against the current Unix time in seconds, rounded to the
 * nearest second. Each factory has an overload taking a {@link Clock} so tests can pin "now".
 */
public final class ClaimPredicates {

    private ClaimPredicates() {
        // utility class
    }

    /** The claim strictly equals {@code expected}. */
    public static ClaimPredicate equalTo(String key, Object expected) {
        return new Equals(key, expected);
    }

    /** The claim is a number strictly greater than now. */
    public static ClaimPredicate inFuture(String key) {
        return inFuture(key, Clock.systemUTC());
    }

    public static ClaimPredicate inFuture(String key, Clock clock) {
        return new InFuture(key, clock);
    }

    /** The claim is a number less than or equal to now. */
    public static ClaimPredicate inPast(String key) {
        return inPast(key, Clock.systemUTC());
    }

    public static ClaimPredicate inPast(String key, Clock clock) {
        return new InPast(key, clock);
    }

    /** The claim is a non-empty string. */
    public static ClaimPredicate notEmpty(String key) {
        return new NotEmpty(key);
    }

    static long nowSeconds(Clock clock) {
        return Math.round(clock.millis() / 1000.0);
    }

    /**
     * Claim equals an expected value. Numbers compare by value, so {@code 1} equals
     * {@code 1L} and {@code 1.0}; every other type compares with {@link Object#equals}.
     *
     * @param key      claim name
     * @param expected expected value
     */
    public record Equals(String key, Object expected) implements ClaimPredicate {

        public Equals {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public boolean evaluate(ClaimMap claims) {
            Object actual = claims.get(key).orElse(null);
            if (actual instanceof Number a && expected instanceof Number e) {
                try {
                    return toDecimal(a).compareTo(toDecimal(e)) == 0;
                } catch (NumberFormatException nonFinite) {
                    // NaN and infinities never equal anything
                    return false;
                }
            }
            return actual != null && actual.equals(expected);
        }

        @Override
        public String describe() {
            return "%s equals '%s'".formatted(key, expected);
        }

        private static BigDecimal toDecimal(Number n) {
            return new BigDecimal(n.toString());
        }
    }

    /**
     * Claim is a timestamp strictly after now.
     *
     * @param key   claim name
     * @param clock time source
     */
    public record InFuture(String key, Clock clock) implements ClaimPredicate {

        public InFuture {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(clock, "clock");
        }

        @Override
        public boolean evaluate(ClaimMap claims) {
            return claims.getNumber(key)
                    .map(value -> value.doubleValue() > nowSeconds(clock))
                    .orElse(false);
        }

        @Override
        public String describe() {
            return key + " is in the future";
        }
    }

    /**
     * Claim is a timestamp at or before now.
     *
     * @param key   claim name
     * @param clock time source
     */
    public record InPast(String key, Clock clock) implements ClaimPredicate {

        public InPast {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(clock, "clock");
        }

        @Override
        public boolean evaluate(ClaimMap claims) {
            return claims.getNumber(key)
                    .map(value -> value.doubleValue() <= nowSeconds(clock))
                    .orElse(false);
        }

        @Override
        public String describe() {
            return key + " is in the past";
        }
    }

    /**
     * Claim is a string with at least one character.
     *
     * @param key claim name
     */
    public record NotEmpty(String key) implements ClaimPredicate {

        public NotEmpty {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public boolean evaluate(ClaimMap claims) {
            return claims.getString(key).map(s -> !s.isEmpty()).orElse(false);
        }

        @Override
        public String describe() {
            return key + " is not empty";
        }
    }
}
