package com.idgate.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks personal data in token claims before they are written to a log.
 * <p>
 * A claim is masked when its name contains one of the configured patterns
 * (case-insensitive). The defaults cover the personal claims Firebase puts into ID tokens:
 * email, phone number, display name, picture and the {@code firebase} identities block.
 */
public final class ClaimRedactor {

    /** Replacement for masked values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_PATTERNS = Set.of(
            "email", "phone", "name", "picture", "firebase", "token", "secret"
    );

    private final Set<String> patterns;
    private final Pattern compiledPattern;

    public ClaimRedactor() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * Creates a redactor masking claims whose names contain any of the given patterns.
     *
     * @param patterns claim name fragments, matched case-insensitively
     */
    public ClaimRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.patterns = Set.copyOf(patterns);
        String regex = String.join("|", this.patterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of the claims with sensitive values replaced by {@value #REDACTED}.
     * Insertion order is kept. Null input returns an empty map.
     */
    public Map<String, Object> redact(Map<String, ?> claims) {
        if (claims == null || claims.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> result = new LinkedHashMap<>(claims.size());
        claims.forEach((name, value) -> result.put(name, isSensitive(name) ? REDACTED : value));
        return result;
    }

    public boolean isSensitive(String claimName) {
        return claimName != null && compiledPattern.matcher(claimName).find();
    }

    public Set<String> patterns() {
        return patterns;
    }
}
