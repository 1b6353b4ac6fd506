package com.atrium.authorization.store;

/**
 * A named bundle of permissions, as read from the role store.
 * <p>
 * A system role has no tenant and applies under every tenant; a tenant role belongs to exactly
 * one tenant. A row violating that pairing is malformed and never grants anything.
 *
 * @param id         unique role identifier
 * @param tenantId   owning tenant, or {@code null} for a system role
 * @param name       display name, unique per tenant (or among system roles)
 * @param systemRole whether the role is cross-tenant
 */
public record RoleDefinition(String id, String tenantId, String name, boolean systemRole) {

    public static RoleDefinition tenantRole(String id, String tenantId, String name) {
        return new RoleDefinition(id, tenantId, name, false);
    }

    public static RoleDefinition systemRole(String id, String name) {
        return new RoleDefinition(id, null, name, true);
    }

    /**
     * True when the tenant id and the system flag agree.
     */
    public boolean wellFormed() {
        return id != null && (systemRole ? tenantId == null : tenantId != null && !tenantId.isBlank());
    }

    /**
     * Checks whether this role may contribute grants to a principal of {@code principalTenantId}.
     */
    public boolean appliesTo(String principalTenantId) {
        return systemRole || (tenantId != null && tenantId.equals(principalTenantId));
    }
}
