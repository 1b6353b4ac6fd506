package com.atrium.authorization.store;

/**
 * Thrown by a {@link RoleStore} when a lookup cannot be answered (timeout, connection failure,
 * interruption).
 * <p>
 * Never escapes the decision engine: it is always turned into a
 * {@code store_unavailable} denial.
 */
public class RoleStoreException extends RuntimeException {

    private final String lookup;

    public RoleStoreException(String lookup, String message) {
        super(message);
        this.lookup = lookup;
    }

    public RoleStoreException(String lookup, String message, Throwable cause) {
        super(message, cause);
        this.lookup = lookup;
    }

    /** The store operation that failed (e.g., "getGrants"). */
    public String lookup() {
        return lookup;
    }
}
