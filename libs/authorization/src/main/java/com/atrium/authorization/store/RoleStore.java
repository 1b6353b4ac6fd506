package com.atrium.authorization.store;

import java.util.Optional;
import java.util.Set;

/**
 * Read-only view of tenants' roles, grants and assignments, owned by the persistence layer.
 * <p>
 * The core treats an implementation as a queryable snapshot. Implementations backed by a cache
 * must bound their staleness (see {@link CachingRoleStore}); changes to grants become visible
 * to decisions once that window has passed. Every method may block and may throw
 * {@link RoleStoreException}.
 */
public interface RoleStore {

    /**
     * Role ids assigned to the user, tenant roles and system roles alike. Empty when the user has
     * no roles or is unknown.
     */
    Set<String> getRolesForUser(String userId);

    /**
     * The role row, or empty if the role does not exist (e.g., was deleted).
     */
    Optional<RoleDefinition> findRole(String roleId);

    /**
     * Grants attached to the role. Empty for unknown roles.
     */
    Set<PermissionGrant> getGrants(String roleId);

    /**
     * False for deleted roles and for tenant roles whose tenant is inactive.
     */
    boolean isRoleActive(String roleId);
}
