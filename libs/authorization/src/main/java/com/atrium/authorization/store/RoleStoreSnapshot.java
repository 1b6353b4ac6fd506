package com.atrium.authorization.store;

import com.atrium.authorization.Operation;
import com.atrium.authorization.Scope;
import com.atrium.authorization.TenantStatus;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable point-in-time copy of tenants, roles, grants and user-role assignments.
 * <p>
 * Every {@code with...} method returns a new snapshot and leaves this one untouched, so a
 * snapshot can be published through an {@link java.util.concurrent.atomic.AtomicReference} and
 * read without locks.
 *
 * @param tenants     tenant id to status
 * @param roles       role id to role row
 * @param grants      role id to grants keyed by operation (at most one grant per operation)
 * @param assignments user id to assigned role ids
 */
public record RoleStoreSnapshot(
        Map<String, TenantStatus> tenants,
        Map<String, RoleDefinition> roles,
        Map<String, Map<Operation, PermissionGrant>> grants,
        Map<String, Set<String>> assignments) {

    private static final RoleStoreSnapshot EMPTY =
            new RoleStoreSnapshot(Map.of(), Map.of(), Map.of(), Map.of());

    public RoleStoreSnapshot {
        tenants = Map.copyOf(tenants);
        roles = Map.copyOf(roles);
        grants = deepCopy(grants);
        assignments = copyAssignments(assignments);
    }

    public static RoleStoreSnapshot empty() {
        return EMPTY;
    }

    public Set<String> rolesForUser(String userId) {
        return assignments.getOrDefault(userId, Set.of());
    }

    public Optional<RoleDefinition> role(String roleId) {
        return Optional.ofNullable(roles.get(roleId));
    }

    public Set<PermissionGrant> grantsFor(String roleId) {
        Map<Operation, PermissionGrant> byOperation = grants.get(roleId);
        return byOperation == null ? Set.of() : Set.copyOf(byOperation.values());
    }

    /**
     * A role is active when it exists and is either a system role or belongs to an active tenant.
     */
    public boolean roleActive(String roleId) {
        RoleDefinition role = roles.get(roleId);
        if (role == null) {
            return false;
        }
        if (role.systemRole()) {
            return true;
        }
        return tenants.get(role.tenantId()) == TenantStatus.ACTIVE;
    }

    public RoleStoreSnapshot withTenant(String tenantId, TenantStatus status) {
        Map<String, TenantStatus> next = new HashMap<>(tenants);
        next.put(tenantId, status);
        return new RoleStoreSnapshot(next, roles, grants, assignments);
    }

    /**
     * Adds or replaces a role.
     *
     * @throws IllegalArgumentException if another role already uses the name within the same
     *                                  tenant (or among system roles), or if the role's tenant
     *                                  would change
     */
    public RoleStoreSnapshot withRole(RoleDefinition role) {
        if (!role.wellFormed()) {
            throw new IllegalArgumentException("role '%s' must have a tenantId exactly when it is not a system role"
                    .formatted(role.id()));
        }
        RoleDefinition existing = roles.get(role.id());
        if (existing != null && !Objects.equals(existing.tenantId(), role.tenantId())) {
            throw new IllegalArgumentException("role '%s' cannot move from tenant '%s' to '%s'"
                    .formatted(role.id(), existing.tenantId(), role.tenantId()));
        }
        for (RoleDefinition other : roles.values()) {
            if (!other.id().equals(role.id())
                    && other.name().equals(role.name())
                    && other.systemRole() == role.systemRole()
                    && Objects.equals(other.tenantId(), role.tenantId())) {
                throw new IllegalArgumentException("role name '%s' is already used by role '%s'"
                        .formatted(role.name(), other.id()));
            }
        }
        Map<String, RoleDefinition> next = new HashMap<>(roles);
        next.put(role.id(), role);
        return new RoleStoreSnapshot(tenants, next, grants, assignments);
    }

    /**
     * Removes a role together with its grants and every assignment referencing it.
     */
    public RoleStoreSnapshot withoutRole(String roleId) {
        Map<String, RoleDefinition> nextRoles = new HashMap<>(roles);
        nextRoles.remove(roleId);
        Map<String, Map<Operation, PermissionGrant>> nextGrants = new HashMap<>(grants);
        nextGrants.remove(roleId);
        Map<String, Set<String>> nextAssignments = new HashMap<>();
        assignments.forEach((userId, roleIds) -> {
            Set<String> remaining = new HashSet<>(roleIds);
            remaining.remove(roleId);
            nextAssignments.put(userId, remaining);
        });
        return new RoleStoreSnapshot(tenants, nextRoles, nextGrants, nextAssignments);
    }

    /**
     * Records a grant. When the role already holds the operation, the wider scope is kept.
     */
    public RoleStoreSnapshot withGrant(String roleId, Operation operation, Scope scope) {
        if (!roles.containsKey(roleId)) {
            throw new IllegalArgumentException("unknown role '%s'".formatted(roleId));
        }
        Map<String, Map<Operation, PermissionGrant>> next = new HashMap<>(grants);
        Map<Operation, PermissionGrant> byOperation = new LinkedHashMap<>(grants.getOrDefault(roleId, Map.of()));
        PermissionGrant current = byOperation.get(operation);
        Scope effective = current == null || current.scope() == null ? scope : current.scope().widen(scope);
        byOperation.put(operation, PermissionGrant.of(operation, effective));
        next.put(roleId, byOperation);
        return new RoleStoreSnapshot(tenants, roles, next, assignments);
    }

    public RoleStoreSnapshot withoutGrant(String roleId, Operation operation) {
        Map<Operation, PermissionGrant> current = grants.get(roleId);
        if (current == null || !current.containsKey(operation)) {
            return this;
        }
        Map<Operation, PermissionGrant> byOperation = new LinkedHashMap<>(current);
        byOperation.remove(operation);
        Map<String, Map<Operation, PermissionGrant>> next = new HashMap<>(grants);
        next.put(roleId, byOperation);
        return new RoleStoreSnapshot(tenants, roles, next, assignments);
    }

    public RoleStoreSnapshot withAssignment(String userId, String roleId) {
        if (!roles.containsKey(roleId)) {
            throw new IllegalArgumentException("unknown role '%s'".formatted(roleId));
        }
        Map<String, Set<String>> next = new HashMap<>(assignments);
        Set<String> roleIds = new HashSet<>(assignments.getOrDefault(userId, Set.of()));
        roleIds.add(roleId);
        next.put(userId, roleIds);
        return new RoleStoreSnapshot(tenants, roles, grants, next);
    }

    public RoleStoreSnapshot withoutAssignment(String userId, String roleId) {
        Set<String> current = assignments.get(userId);
        if (current == null || !current.contains(roleId)) {
            return this;
        }
        Map<String, Set<String>> next = new HashMap<>(assignments);
        Set<String> roleIds = new HashSet<>(current);
        roleIds.remove(roleId);
        next.put(userId, roleIds);
        return new RoleStoreSnapshot(tenants, roles, grants, next);
    }

    private static Map<String, Map<Operation, PermissionGrant>> deepCopy(
            Map<String, Map<Operation, PermissionGrant>> source) {
        Map<String, Map<Operation, PermissionGrant>> copy = new HashMap<>();
        source.forEach((roleId, byOperation) -> copy.put(roleId, Map.copyOf(byOperation)));
        return Map.copyOf(copy);
    }

    private static Map<String, Set<String>> copyAssignments(Map<String, Set<String>> source) {
        Map<String, Set<String>> copy = new HashMap<>();
        source.forEach((userId, roleIds) -> copy.put(userId, Set.copyOf(roleIds)));
        return Map.copyOf(copy);
    }
}
