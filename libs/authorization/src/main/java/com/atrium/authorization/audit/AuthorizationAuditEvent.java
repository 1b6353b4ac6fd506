package com.atrium.authorization.audit;

import com.atrium.authorization.Decision;
import com.atrium.authorization.Operation;
import com.atrium.authorization.Principal;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of a single authorization decision.
 *
 * @param eventId   unique id of this audit record
 * @param tenantId  principal's tenant
 * @param userId    principal's user id
 * @param module    requested module
 * @param action    requested action
 * @param outcome   "allow" or "deny"
 * @param scope     resolved scope value for an allow, otherwise {@code null}
 * @param reason    deny reason code for a deny, otherwise {@code null}
 * @param timestamp when the decision was made
 */
public record AuthorizationAuditEvent(
        String eventId,
        String tenantId,
        String userId,
        String module,
        String action,
        String outcome,
        String scope,
        String reason,
        Instant timestamp) {

    public static final String OUTCOME_ALLOW = "allow";
    public static final String OUTCOME_DENY = "deny";

    public static AuthorizationAuditEvent of(
            Principal principal, Operation operation, Decision decision, Instant timestamp) {
        String scope = null;
        String reason = null;
        if (decision instanceof Decision.Allow allow) {
            scope = allow.scope().value();
        } else if (decision instanceof Decision.Deny deny) {
            reason = deny.reason().code();
        }
        return new AuthorizationAuditEvent(
                UUID.randomUUID().toString(),
                principal.tenantId(),
                principal.userId(),
                operation.module(),
                operation.action(),
                decision.allowed() ? OUTCOME_ALLOW : OUTCOME_DENY,
                scope,
                reason,
                timestamp);
    }
}
