package com.atrium.authorization;

/**
 * Why an operation was denied.
 * <p>
 * Reason codes are for server-side logs and audit only; callers map every denial to the same
 * access-denied response. {@link #STORE_UNAVAILABLE} may additionally be surfaced as a
 * service-unavailable response.
 */
public enum DenyReason {

    TENANT_INACTIVE("tenant_inactive"),
    USER_INACTIVE("user_inactive"),
    NO_GRANT("no_grant"),
    UNKNOWN_OPERATION("unknown_operation"),
    STORE_UNAVAILABLE("store_unavailable");

    private final String code;

    DenyReason(String code) {
        this.code = code;
    }

    /** The reason code (e.g., "no_grant"). */
    public String code() {
        return code;
    }

    /**
     * True when the denial was caused by a failing dependency rather than by the principal's
     * permissions.
     */
    public boolean isDependencyFailure() {
        return this == STORE_UNAVAILABLE;
    }
}
