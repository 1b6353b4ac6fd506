package com.atrium.authorization;

import com.atrium.authorization.audit.AsyncAuditPublisher;
import com.atrium.authorization.store.CachingRoleStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the authorization core, bound from {@code atrium.authorization.*}.
 * <p>
 * Defaults are applied in the compact constructor, before Bean Validation runs, so an empty
 * configuration is valid:
 *
 * <pre>
 * atrium:
 *   authorization:
 *     service-name: school-api
 *     lookup-timeout: 2s
 *     lookup-threads: 16
 *     lookup-queue-capacity: 256
 *     role-source: store
 *     cache:
 *       enabled: true
 *       ttl: 10m
 *       maximum-size: 10000
 *     retry:
 *       max-attempts: 2
 *       backoff: 50ms
 *     audit:
 *       enabled: true
 *       queue-capacity: 1024
 *     manage-permissions-operation: user_management:read
 *     catalog:
 *       students: [create, read, update, delete, export]
 *     routes:
 *       studentList: students:read
 * </pre>
 *
 * @param serviceName                value of the {@code service} tag on every meter
 * @param lookupTimeout              deadline for the role store lookup behind one decision
 * @param lookupThreads              size of the lookup thread pool
 * @param lookupQueueCapacity        lookups waiting for a thread before new ones are refused
 * @param roleSource                 where the engine takes role ids from
 * @param cache                      role store caching
 * @param retry                      role store retries
 * @param audit                      audit publishing
 * @param managePermissionsOperation operation guarding the catalog listing, {@code module:action}
 * @param catalog                    module to actions; empty means the default school catalog
 * @param routes                     route key to requirement; empty means the default route map
 */
@ConfigurationProperties(prefix = "atrium.authorization")
@Validated
public record AuthorizationProperties(
        @NotBlank String serviceName,
        @NotNull Duration lookupTimeout,
        int lookupThreads,
        int lookupQueueCapacity,
        @NotNull RoleSource roleSource,
        @Valid Cache cache,
        @Valid Retry retry,
        @Valid Audit audit,
        @NotBlank String managePermissionsOperation,
        Map<String, List<String>> catalog,
        Map<String, String> routes) {

    public AuthorizationProperties {
        if (serviceName == null || serviceName.isBlank()) {
            serviceName = "atrium";
        }
        if (lookupTimeout == null || lookupTimeout.compareTo(AuthorizationEngine.MIN_LOOKUP_TIMEOUT) < 0) {
            lookupTimeout = AuthorizationEngine.DEFAULT_LOOKUP_TIMEOUT;
        }
        if (lookupThreads <= 0) {
            lookupThreads = 16;
        }
        if (lookupQueueCapacity <= 0) {
            lookupQueueCapacity = 256;
        }
        if (roleSource == null) {
            roleSource = RoleSource.STORE;
        }
        if (cache == null) {
            cache = new Cache(null, null, 0);
        }
        if (retry == null) {
            retry = new Retry(0, null);
        }
        if (audit == null) {
            audit = new Audit(null, 0);
        }
        if (managePermissionsOperation == null || managePermissionsOperation.isBlank()) {
            managePermissionsOperation = PermissionCatalogService.DEFAULT_MANAGE_OPERATION.toString();
        }
        catalog = catalog == null ? Map.of() : Map.copyOf(catalog);
        routes = routes == null ? Map.of() : Map.copyOf(routes);
    }

    /** Properties with every default applied. */
    public static AuthorizationProperties defaults() {
        return new AuthorizationProperties(null, null, 0, 0, null, null, null, null, null, null, null);
    }

    /** The configured catalog, or the default school catalog when none is configured. */
    public PermissionCatalog permissionCatalog() {
        return catalog.isEmpty() ? PermissionCatalog.defaults() : PermissionCatalog.of(catalog);
    }

    public Operation manageOperation() {
        return Operation.parse(managePermissionsOperation);
    }

    /** The configured route map, or {@link RouteAccessEvaluator#DEFAULT_ROUTES} when none is configured. */
    public Map<String, String> routeDeclarations() {
        return routes.isEmpty() ? RouteAccessEvaluator.DEFAULT_ROUTES : routes;
    }

    /**
     * @param enabled     whether role store reads are cached
     * @param ttl         how long a cached read is served; the staleness bound for grant changes
     * @param maximumSize entries kept per lookup kind
     */
    public record Cache(Boolean enabled, Duration ttl, long maximumSize) {

        public Cache {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                ttl = CachingRoleStore.DEFAULT_TTL;
            }
            if (maximumSize <= 0) {
                maximumSize = CachingRoleStore.DEFAULT_MAXIMUM_SIZE;
            }
        }
    }

    /**
     * @param maxAttempts attempts per role store read, including the first
     * @param backoff     base delay; attempt n waits {@code backoff * n}
     */
    public record Retry(int maxAttempts, Duration backoff) {

        public Retry {
            if (maxAttempts <= 0) {
                maxAttempts = 2;
            }
            if (backoff == null || backoff.isNegative()) {
                backoff = Duration.ofMillis(50);
            }
        }
    }

    /**
     * @param enabled       whether decisions are audited
     * @param queueCapacity events buffered before new ones are dropped
     */
    public record Audit(Boolean enabled, int queueCapacity) {

        public Audit {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (queueCapacity <= 0) {
                queueCapacity = AsyncAuditPublisher.DEFAULT_CAPACITY;
            }
        }
    }
}
