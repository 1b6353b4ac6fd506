package com.atrium.authorization.audit;

/**
 * Destination for authorization audit events.
 * <p>
 * Called on the decision path unless wrapped in an {@link AsyncAuditPublisher}. Implementations
 * may throw; callers treat a failing sink as a dropped event, never as a failed decision.
 */
@FunctionalInterface
public interface AuditSink {

    void emit(AuthorizationAuditEvent event);
}
