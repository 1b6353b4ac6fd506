package com.atrium.authorization.store;

import com.atrium.authorization.AuthorizationMetrics;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Read-through cache in front of another {@link RoleStore}.
 * <p>
 * Staleness is bounded by the TTL: an entry older than {@code ttl} is reloaded from the delegate
 * on its next read, so a grant change is reflected in decisions at most {@code ttl} after it is
 * committed (or immediately after an explicit {@code invalidate...} call).
 * <p>
 * Each lookup kind has its own Caffeine cache, expiring entries {@code ttl} after they are
 * written and holding at most {@code maximumSize} entries. Cached values are immutable, so a
 * reader sees either the old or the new value. A load that overlaps an invalidation is dropped
 * once it completes. Failures of the delegate are rethrown and never cached.
 */
public final class CachingRoleStore implements RoleStore {

    private static final Logger log = LoggerFactory.getLogger(CachingRoleStore.class);

    /** Default staleness bound, matching the platform's session permission cache. */
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(10);

    /** Default entry limit, per lookup kind. */
    public static final long DEFAULT_MAXIMUM_SIZE = 10_000;

    private final RoleStore delegate;
    private final Duration ttl;
    private final AuthorizationMetrics metrics;
    private final AtomicLong generation = new AtomicLong();

    private final Cache<String, Set<String>> userRoles;
    private final Cache<String, Optional<RoleDefinition>> roles;
    private final Cache<String, Set<PermissionGrant>> grants;
    private final Cache<String, Boolean> activeRoles;

    public CachingRoleStore(RoleStore delegate, Duration ttl) {
        this(delegate, ttl, Clock.systemUTC(), AuthorizationMetrics.standalone());
    }

    public CachingRoleStore(RoleStore delegate, Duration ttl, Clock clock, AuthorizationMetrics metrics) {
        this(delegate, ttl, DEFAULT_MAXIMUM_SIZE, clock, metrics);
    }

    /**
     * @param delegate    the store being cached
     * @param ttl         how long a loaded value is served
     * @param maximumSize entry limit of each lookup kind
     * @param clock       drives expiry
     * @param metrics     counts loads per kind
     */
    public CachingRoleStore(
            RoleStore delegate, Duration ttl, long maximumSize, Clock clock, AuthorizationMetrics metrics) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.delegate = delegate;
        this.ttl = ttl;
        this.metrics = metrics;
        Ticker ticker = () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
        this.userRoles = newCache(ttl, maximumSize, ticker);
        this.roles = newCache(ttl, maximumSize, ticker);
        this.grants = newCache(ttl, maximumSize, ticker);
        this.activeRoles = newCache(ttl, maximumSize, ticker);
    }

    @Override
    public Set<String> getRolesForUser(String userId) {
        return lookup(userRoles, "user_roles", userId, id -> Set.copyOf(delegate.getRolesForUser(id)));
    }

    @Override
    public Optional<RoleDefinition> findRole(String roleId) {
        return lookup(roles, "role", roleId, delegate::findRole);
    }

    @Override
    public Set<PermissionGrant> getGrants(String roleId) {
        return lookup(grants, "grants", roleId, id -> Set.copyOf(delegate.getGrants(id)));
    }

    @Override
    public boolean isRoleActive(String roleId) {
        return lookup(activeRoles, "active", roleId, delegate::isRoleActive);
    }

    /** Drops the cached role assignments of one user. */
    public void invalidateUser(String userId) {
        generation.incrementAndGet();
        userRoles.invalidate(userId);
        log.debug("Role cache invalidated for user {}", userId);
    }

    /**
     * Drops everything cached about a role, and the assignments of every cached user holding it.
     */
    public void invalidateRole(String roleId) {
        generation.incrementAndGet();
        roles.invalidate(roleId);
        grants.invalidate(roleId);
        activeRoles.invalidate(roleId);
        userRoles.asMap().values().removeIf(roleIds -> roleIds.contains(roleId));
        log.debug("Role cache invalidated for role {}", roleId);
    }

    /**
     * Drops the cached activity flag of every role belonging to the tenant, e.g. after the tenant
     * was deactivated. Activity flags of roles whose row is not cached are dropped as well.
     */
    public void invalidateTenant(String tenantId) {
        generation.incrementAndGet();
        activeRoles.asMap().keySet().removeIf(roleId -> belongsToTenantOrUnknown(roleId, tenantId));
        log.debug("Role cache invalidated for tenant {}", tenantId);
    }

    public void invalidateAll() {
        generation.incrementAndGet();
        caches().forEach(Cache::invalidateAll);
        log.debug("Role cache cleared");
    }

    /** Number of entries currently held, across all lookup kinds. */
    public long size() {
        long size = 0;
        for (Cache<String, ?> cache : caches()) {
            cache.cleanUp();
            size += cache.estimatedSize();
        }
        return size;
    }

    public Duration ttl() {
        return ttl;
    }

    private <V> V lookup(Cache<String, V> cache, String kind, String id, Function<String, V> loader) {
        V cached = cache.getIfPresent(id);
        if (cached != null) {
            return cached;
        }
        long before = generation.get();
        V loaded = cache.get(id, key -> {
            metrics.recordCacheLoad(kind);
            return loader.apply(key);
        });
        if (generation.get() != before) {
            cache.asMap().remove(id, loaded);
        }
        return loaded;
    }

    private boolean belongsToTenantOrUnknown(String roleId, String tenantId) {
        Optional<RoleDefinition> role = roles.getIfPresent(roleId);
        return role == null || role.isEmpty() || tenantId.equals(role.get().tenantId());
    }

    private List<Cache<String, ?>> caches() {
        return List.of(userRoles, roles, grants, activeRoles);
    }

    private static <V> Cache<String, V> newCache(Duration ttl, long maximumSize, Ticker ticker) {
        return Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .ticker(ticker)
                .build();
    }
}
