package com.atrium.authorization;

/**
 * Lifecycle status of a tenant. Only {@link #ACTIVE} tenants may perform operations.
 */
public enum TenantStatus {

    ACTIVE("active"),
    INACTIVE("inactive");

    private final String value;

    TenantStatus(String value) {
        this.value = value;
    }

    /** The canonical string representation. */
    public String value() {
        return value;
    }
}
