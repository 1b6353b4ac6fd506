package com.atrium.authorization;

import com.atrium.authorization.store.PermissionGrant;
import com.atrium.authorization.store.RoleDefinition;
import com.atrium.authorization.store.RoleStore;
import com.atrium.authorization.store.RoleStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Computes the effective scope a user holds for an operation by combining the grants of all of
 * the user's roles.
 * <p>
 * Combination is an OR over scopes with {@link Scope#FULL} on top: no grant means denied, any
 * {@code full} grant yields {@code full}, otherwise {@code own}. Adding a role can only widen the
 * result. Roles that do not exist, are inactive, belong to another tenant or are malformed
 * contribute nothing; malformed grants are skipped and counted.
 * <p>
 * Stateless and safe for concurrent use. Role store failures propagate as
 * {@link RoleStoreException}.
 */
public final class PermissionResolver {

    private static final Logger log = LoggerFactory.getLogger(PermissionResolver.class);

    /** Violation kind for a grant outside the catalog or without a scope. */
    public static final String MALFORMED_GRANT = "malformed_grant";

    /** Violation kind for a role whose tenant id disagrees with its system flag. */
    public static final String MALFORMED_ROLE = "malformed_role";

    private final PermissionCatalog catalog;
    private final RoleStore roleStore;
    private final AuthorizationMetrics metrics;

    public PermissionResolver(PermissionCatalog catalog, RoleStore roleStore, AuthorizationMetrics metrics) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog must not be null");
        }
        if (roleStore == null) {
            throw new IllegalArgumentException("roleStore must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.catalog = catalog;
        this.roleStore = roleStore;
        this.metrics = metrics;
    }

    /**
     * Resolves the scope for a user, reading the user's role assignments from the role store.
     *
     * @param tenantId  the principal's tenant; tenant roles of other tenants are ignored
     * @param userId    the user
     * @param operation the requested operation
     * @return the combined scope, or empty when denied
     * @throws RoleStoreException if the role store cannot answer
     */
    public Optional<Scope> resolve(String tenantId, String userId, Operation operation) {
        if (!catalog.isValidOperation(operation)) {
            return Optional.empty();
        }
        return resolve(tenantId, roleStore.getRolesForUser(userId), operation);
    }

    /**
     * Resolves the scope granted by an explicit set of roles.
     *
     * @throws RoleStoreException if the role store cannot answer
     */
    public Optional<Scope> resolve(String tenantId, Collection<String> roleIds, Operation operation) {
        if (!catalog.isValidOperation(operation)) {
            return Optional.empty();
        }
        if (roleIds == null || roleIds.isEmpty()) {
            return Optional.empty();
        }

        Optional<Scope> combined = Optional.empty();
        for (String roleId : new TreeSet<>(roleIds)) {
            if (!eligible(tenantId, roleId)) {
                continue;
            }
            for (PermissionGrant grant : roleStore.getGrants(roleId)) {
                if (wellFormed(roleId, grant) && grant.matches(operation)) {
                    combined = Optional.of(combined.map(grant.scope()::widen).orElse(grant.scope()));
                }
            }
            if (combined.isPresent() && combined.get() == Scope.FULL) {
                // nothing can widen further
                break;
            }
        }
        return combined;
    }

    /**
     * Resolves every operation the user holds, for listing what a user can do.
     *
     * @throws RoleStoreException if the role store cannot answer
     */
    public EffectivePermissions resolveAll(String tenantId, String userId) {
        return resolveAll(tenantId, roleStore.getRolesForUser(userId));
    }

    /**
     * Resolves every operation granted by an explicit set of roles.
     *
     * @throws RoleStoreException if the role store cannot answer
     */
    public EffectivePermissions resolveAll(String tenantId, Collection<String> roleIds) {
        if (roleIds == null || roleIds.isEmpty()) {
            return EffectivePermissions.none();
        }
        Map<Operation, Scope> scopes = new HashMap<>();
        for (String roleId : new TreeSet<>(roleIds)) {
            if (!eligible(tenantId, roleId)) {
                continue;
            }
            for (PermissionGrant grant : roleStore.getGrants(roleId)) {
                if (wellFormed(roleId, grant)) {
                    scopes.merge(new Operation(grant.module(), grant.action()), grant.scope(), Scope::widen);
                }
            }
        }
        return new EffectivePermissions(scopes);
    }

    /**
     * Combines the scopes granted by several roles for one operation.
     *
     * @param granted scopes from every applicable grant, duplicates allowed
     * @return empty if nothing was granted, {@code FULL} if any grant is full, otherwise {@code OWN}
     */
    public static Optional<Scope> combine(Collection<Scope> granted) {
        Optional<Scope> combined = Optional.empty();
        for (Scope scope : granted) {
            if (scope != null) {
                combined = Optional.of(combined.map(scope::widen).orElse(scope));
            }
        }
        return combined;
    }

    public PermissionCatalog catalog() {
        return catalog;
    }

    /** The store the resolver reads, including any caching or retry layers. */
    public RoleStore roleStore() {
        return roleStore;
    }

    private boolean eligible(String tenantId, String roleId) {
        Optional<RoleDefinition> found = roleStore.findRole(roleId);
        if (found.isEmpty()) {
            log.debug("Ignoring role {}: not found", roleId);
            return false;
        }
        RoleDefinition role = found.get();
        if (!role.wellFormed()) {
            metrics.recordInvariantViolation(MALFORMED_ROLE);
            log.warn("Ignoring malformed role {}: systemRole={} tenantId={}",
                    roleId, role.systemRole(), role.tenantId());
            return false;
        }
        if (!role.appliesTo(tenantId)) {
            log.debug("Ignoring role {}: belongs to tenant {}, not {}", roleId, role.tenantId(), tenantId);
            return false;
        }
        if (!roleStore.isRoleActive(roleId)) {
            log.debug("Ignoring role {}: inactive", roleId);
            return false;
        }
        return true;
    }

    private boolean wellFormed(String roleId, PermissionGrant grant) {
        if (grant != null && grant.scope() != null && catalog.isValidOperation(grant.module(), grant.action())) {
            return true;
        }
        metrics.recordInvariantViolation(MALFORMED_GRANT);
        log.warn("Ignoring malformed grant on role {}: {}", roleId, grant);
        return false;
    }
}
