package com.atrium.authorization;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer instruments for the authorization core.
 * <p>
 * Every meter carries a {@code service} tag. Meters are looked up through the registry on each
 * call, which returns the already-registered instance for an existing name and tag set.
 */
public final class AuthorizationMetrics {

    /** Decisions by outcome; tagged {@code outcome} and {@code detail} (scope or reason code). */
    public static final String DECISIONS = "atrium.authorization.decisions";

    /** Time spent producing a decision, including the role store lookup. */
    public static final String DECISION_DURATION = "atrium.authorization.decision.duration";

    /** Malformed grants and roles skipped by the resolver; tagged {@code kind}. */
    public static final String INVARIANT_VIOLATIONS = "atrium.authorization.invariant.violations";

    /** Audit events discarded because the publisher queue was full or the sink failed. */
    public static final String AUDIT_DROPPED = "atrium.authorization.audit.dropped";

    /** Role store loads performed by the cache on a miss or expiry; tagged {@code kind}. */
    public static final String CACHE_LOADS = "atrium.authorization.cache.loads";

    public static final String TAG_SERVICE = "service";
    public static final String TAG_OUTCOME = "outcome";
    public static final String TAG_DETAIL = "detail";
    public static final String TAG_KIND = "kind";

    private final MeterRegistry registry;
    private final String serviceName;

    /**
     * @param registry    the meter registry (e.g., the host's PrometheusMeterRegistry)
     * @param serviceName logical service name included as a tag on every meter
     */
    public AuthorizationMetrics(MeterRegistry registry, String serviceName) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        this.registry = registry;
        this.serviceName = serviceName;
    }

    /**
     * Metrics backed by a private in-memory registry, for callers that do not export metrics.
     */
    public static AuthorizationMetrics standalone() {
        return new AuthorizationMetrics(new SimpleMeterRegistry(), "atrium");
    }

    public void recordDecision(Decision decision, Duration elapsed) {
        String outcome = decision.allowed() ? "allow" : "deny";
        String detail;
        if (decision instanceof Decision.Allow allow) {
            detail = allow.scope().value();
        } else {
            detail = ((Decision.Deny) decision).reason().code();
        }
        Counter.builder(DECISIONS)
                .description("Authorization decisions")
                .tags(tags(TAG_OUTCOME, outcome, TAG_DETAIL, detail))
                .register(registry)
                .increment();
        Timer.builder(DECISION_DURATION)
                .description("Time to produce an authorization decision")
                .tags(tags(TAG_OUTCOME, outcome))
                .register(registry)
                .record(elapsed);
    }

    public void recordInvariantViolation(String kind) {
        Counter.builder(INVARIANT_VIOLATIONS)
                .description("Malformed role store rows ignored during resolution")
                .tags(tags(TAG_KIND, kind))
                .register(registry)
                .increment();
    }

    public void recordAuditDropped() {
        Counter.builder(AUDIT_DROPPED)
                .description("Audit events that could not be delivered")
                .tags(tags())
                .register(registry)
                .increment();
    }

    public void recordCacheLoad(String kind) {
        Counter.builder(CACHE_LOADS)
                .description("Role store lookups performed on cache miss or expiry")
                .tags(tags(TAG_KIND, kind))
                .register(registry)
                .increment();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String serviceName() {
        return serviceName;
    }

    private Tags tags(String... extraTags) {
        Tags tags = Tags.of(TAG_SERVICE, serviceName);
        if (extraTags.length > 0) {
            tags = tags.and(extraTags);
        }
        return tags;
    }
}
