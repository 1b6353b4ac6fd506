package com.atrium.authorization.store;

import com.atrium.authorization.Operation;
import com.atrium.authorization.Scope;
import com.atrium.authorization.TenantStatus;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Reference {@link RoleStore} holding everything in memory.
 * <p>
 * State lives in one immutable {@link RoleStoreSnapshot}. Reads go to whichever snapshot is
 * current; every mutation builds a successor and swaps it in atomically, so readers never observe
 * a half-applied change. Suitable for tests, demos and small single-node deployments.
 */
public final class InMemoryRoleStore implements RoleStore {

    private final AtomicReference<RoleStoreSnapshot> snapshot;

    public InMemoryRoleStore() {
        this(RoleStoreSnapshot.empty());
    }

    public InMemoryRoleStore(RoleStoreSnapshot initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial snapshot must not be null");
        }
        this.snapshot = new AtomicReference<>(initial);
    }

    @Override
    public Set<String> getRolesForUser(String userId) {
        return snapshot.get().rolesForUser(userId);
    }

    @Override
    public Optional<RoleDefinition> findRole(String roleId) {
        return snapshot.get().role(roleId);
    }

    @Override
    public Set<PermissionGrant> getGrants(String roleId) {
        return snapshot.get().grantsFor(roleId);
    }

    @Override
    public boolean isRoleActive(String roleId) {
        return snapshot.get().roleActive(roleId);
    }

    /** The current snapshot. */
    public RoleStoreSnapshot snapshot() {
        return snapshot.get();
    }

    public InMemoryRoleStore putTenant(String tenantId, TenantStatus status) {
        return update(s -> s.withTenant(tenantId, status));
    }

    public InMemoryRoleStore putRole(RoleDefinition role) {
        return update(s -> s.withRole(role));
    }

    public InMemoryRoleStore deleteRole(String roleId) {
        return update(s -> s.withoutRole(roleId));
    }

    public InMemoryRoleStore grant(String roleId, String module, String action, Scope scope) {
        return update(s -> s.withGrant(roleId, Operation.of(module, action), scope));
    }

    public InMemoryRoleStore revoke(String roleId, String module, String action) {
        return update(s -> s.withoutGrant(roleId, Operation.of(module, action)));
    }

    public InMemoryRoleStore assign(String userId, String roleId) {
        return update(s -> s.withAssignment(userId, roleId));
    }

    public InMemoryRoleStore unassign(String userId, String roleId) {
        return update(s -> s.withoutAssignment(userId, roleId));
    }

    /**
     * Applies a change as a single atomic swap. The function may run more than once under
     * contention and must be free of side effects.
     */
    public InMemoryRoleStore update(UnaryOperator<RoleStoreSnapshot> change) {
        snapshot.updateAndGet(change);
        return this;
    }
}
