package com.idgate.keys;

import java.time.Duration;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives a cache TTL from a {@code Cache-Control} header.
 */
public final class CacheControl {

    /** Subtracted from {@code max-age} so a cached key set expires before the provider's copy. */
    public static final Duration DEFAULT_SAFETY_MARGIN = Duration.ofSeconds(120);

    private static final Pattern MAX_AGE = Pattern.compile("max-age=(\\d+)");

    private CacheControl() {
        // utility class
    }

    /**
     * Returns the {@code max-age} value of the header in seconds.
     *
     * @param header the header value, may be null
     * @return the max-age, or empty if the header is absent or has no parsable max-age
     */
    public static Optional<Long> maxAge(String header) {
        if (header == null) {
            return Optional.empty();
        }
        Matcher matcher = MAX_AGE.matcher(header);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(matcher.group(1)));
        } catch (NumberFormatException e) {
            // more digits than a long holds
            return Optional.empty();
        }
    }

    /**
     * Computes the TTL for caching a response: {@code max-age} minus the safety margin.
     *
     * @param header       the {@code Cache-Control} header, may be null
     * @param safetyMargin duration subtracted from max-age
     * @return the TTL, or empty when there is no max-age or the result is not positive, meaning
     *         the cache's default TTL applies
     */
    public static Optional<Duration> ttl(String header, Duration safetyMargin) {
        return maxAge(header)
                .map(seconds -> Duration.ofSeconds(seconds).minus(safetyMargin))
                .filter(ttl -> !ttl.isNegative() && !ttl.isZero());
    }
}
