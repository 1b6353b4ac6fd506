package com.atrium.authorization;

import java.util.Set;

/**
 * The authenticated identity making a request, as produced by the authentication layer.
 *
 * @param tenantId     tenant the user belongs to
 * @param userId       unique user identifier, also the owner id handed to {@link ScopeFilter.Own}
 * @param roleIds      role ids carried by the authenticated session
 * @param tenantStatus current status of the tenant
 * @param userStatus   current status of the user
 */
public record Principal(
        String tenantId,
        String userId,
        Set<String> roleIds,
        TenantStatus tenantStatus,
        UserStatus userStatus) {

    public Principal {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be null or blank");
        }
        if (tenantStatus == null) {
            throw new IllegalArgumentException("tenantStatus must not be null");
        }
        if (userStatus == null) {
            throw new IllegalArgumentException("userStatus must not be null");
        }
        roleIds = roleIds == null ? Set.of() : Set.copyOf(roleIds);
    }

    public boolean tenantActive() {
        return tenantStatus == TenantStatus.ACTIVE;
    }

    public boolean userActive() {
        return userStatus == UserStatus.ACTIVE;
    }
}
