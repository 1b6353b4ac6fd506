package com.atrium.authorization;

/**
 * Thrown by administrative operations when the caller lacks the required permission.
 * <p>
 * The request-time path never throws this; {@link AuthorizationEngine} returns a
 * {@link Decision.Deny} instead.
 */
public class AuthorizationDeniedException extends RuntimeException {

    private final Operation operation;
    private final DenyReason reason;

    public AuthorizationDeniedException(Operation operation, DenyReason reason) {
        super("Access to '%s' denied: %s".formatted(operation, reason.code()));
        this.operation = operation;
        this.reason = reason;
    }

    public Operation operation() {
        return operation;
    }

    public DenyReason reason() {
        return reason;
    }
}
