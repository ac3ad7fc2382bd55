package com.idgate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer meters for token verification and key lookups.
 * <p>
 * Every meter carries a {@code service} tag. Outcome and reason tags are lower-cased so
 * they read the same in every backend.
 *
 * <ul>
 *   <li>{@value #VERIFICATIONS}: counter tagged {@code outcome} and {@code reason}</li>
 *   <li>{@value #VERIFICATION_DURATION}: timer tagged {@code outcome}</li>
 *   <li>{@value #KEY_LOOKUPS}: counter tagged {@code source}</li>
 * </ul>
 */
public final class VerificationMetrics {

    public static final String VERIFICATIONS = "idgate.auth.verifications";
    public static final String VERIFICATION_DURATION = "idgate.auth.verification.duration";
    public static final String KEY_LOOKUPS = "idgate.auth.jwks.lookups";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_REASON = "reason";
    public static final String TAG_SOURCE = "source";

    /** Outcome tag value for accepted tokens. */
    public static final String AUTHENTICATED = "authenticated";

    /** Outcome tag value for rejected tokens. */
    public static final String REJECTED = "rejected";

    private static final String DEFAULT_SERVICE = "idgate";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * Creates metrics bound to the given registry.
     *
     * @param registry    the meter registry
     * @param serviceName service name used as the {@code service} tag
     */
    public VerificationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    public VerificationMetrics(MeterRegistry registry) {
        this(registry, DEFAULT_SERVICE);
    }

    /** Metrics that record into a registry with no backends. */
    public static VerificationMetrics noop() {
        return new VerificationMetrics(new CompositeMeterRegistry());
    }

    /** Records an accepted token. */
    public void recordAuthenticated(Duration elapsed) {
        counter(AUTHENTICATED, "none").increment();
        timer(AUTHENTICATED).record(elapsed);
    }

    /**
     * Records a rejected token.
     *
     * @param reason the rejection reason, e.g. an enum constant name
     */
    public void recordRejected(String reason, Duration elapsed) {
        counter(REJECTED, reason).increment();
        timer(REJECTED).record(elapsed);
    }

    /**
     * Records where a provider key lookup was answered from.
     *
     * @param source e.g. {@code cache}, {@code network} or {@code unavailable}
     */
    public void recordKeyLookup(String source) {
        Counter.builder(KEY_LOOKUPS)
                .description("Provider key lookups by source")
                .tags(baseTags(TAG_SOURCE, normalize(source)))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Counter counter(String outcome, String reason) {
        return Counter.builder(VERIFICATIONS)
                .description("Token verifications by outcome")
                .tags(baseTags(TAG_OUTCOME, outcome, TAG_REASON, normalize(reason)))
                .register(registry);
    }

    private Timer timer(String outcome) {
        return Timer.builder(VERIFICATION_DURATION)
                .description("Time spent verifying a token")
                .tags(baseTags(TAG_OUTCOME, outcome))
                .register(registry);
    }

    private Tags baseTags(String... extraTags) {
        return Tags.of(TAG_SERVICE, serviceName).and(extraTags);
    }

    private static String normalize(String value) {
        return value == null ? "unknown" : value.toLowerCase(Locale.ROOT);
    }
}
