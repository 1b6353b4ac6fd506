package com.atrium.authorization;

import com.atrium.authorization.audit.AuditSink;
import com.atrium.authorization.audit.AuthorizationAuditEvent;
import com.atrium.authorization.store.RoleStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request-time entry point: decides whether a principal may perform an operation and with what
 * scope.
 * <p>
 * Checks run in this order:
 * <ol>
 *   <li>tenant not active: {@link DenyReason#TENANT_INACTIVE}</li>
 *   <li>user not active: {@link DenyReason#USER_INACTIVE}</li>
 *   <li>operation not in the catalog: {@link DenyReason#UNKNOWN_OPERATION}, whatever the grants</li>
 *   <li>the {@link PermissionResolver}: no grant gives {@link DenyReason#NO_GRANT}, otherwise
 *       {@link Decision.Allow} with the resolved scope and the user as owner</li>
 * </ol>
 * The resolver runs on the lookup executor under a deadline. A role store failure, a timeout, a
 * cancelled or interrupted lookup, or any other failure while resolving yields
 * {@link DenyReason#STORE_UNAVAILABLE}: the engine fails closed and never throws past this class.
 * <p>
 * Stateless per call. Every completed decision is counted, timed and handed to the audit sink; a
 * failing sink never affects the decision.
 */
public final class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    /** Default deadline for the role store lookup behind one decision. */
    public static final Duration DEFAULT_LOOKUP_TIMEOUT = Duration.ofSeconds(2);

    /** Shortest accepted lookup deadline. */
    public static final Duration MIN_LOOKUP_TIMEOUT = Duration.ofMillis(1);

    private final PermissionResolver resolver;
    private final PermissionCatalog catalog;
    private final AuditSink auditSink;
    private final AuthorizationMetrics metrics;
    private final ExecutorService lookupExecutor;
    private final Duration lookupTimeout;
    private final RoleSource roleSource;
    private final Clock clock;

    /**
     * @param resolver       permission resolver
     * @param auditSink      receives one event per completed decision
     * @param metrics        decision counters and timers
     * @param lookupExecutor runs role store lookups; owned by the caller
     * @param lookupTimeout  deadline for one lookup
     * @param roleSource     where role ids come from
     * @param clock          source of audit timestamps
     */
    public AuthorizationEngine(
            PermissionResolver resolver,
            AuditSink auditSink,
            AuthorizationMetrics metrics,
            ExecutorService lookupExecutor,
            Duration lookupTimeout,
            RoleSource roleSource,
            Clock clock) {
        if (resolver == null) {
            throw new IllegalArgumentException("resolver must not be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        if (lookupExecutor == null) {
            throw new IllegalArgumentException("lookupExecutor must not be null");
        }
        if (lookupTimeout == null || lookupTimeout.compareTo(MIN_LOOKUP_TIMEOUT) < 0) {
            throw new IllegalArgumentException("lookupTimeout must be at least " + MIN_LOOKUP_TIMEOUT);
        }
        if (roleSource == null) {
            throw new IllegalArgumentException("roleSource must not be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock must not be null");
        }
        this.resolver = resolver;
        this.catalog = resolver.catalog();
        this.auditSink = auditSink;
        this.metrics = metrics;
        this.lookupExecutor = lookupExecutor;
        this.lookupTimeout = lookupTimeout;
        this.roleSource = roleSource;
        this.clock = clock;
    }

    /**
     * Decides a (module, action) request. Blank names count as an unknown operation.
     */
    public Decision authorize(Principal principal, String module, String action) {
        if (module == null || module.isBlank() || action == null || action.isBlank()) {
            requirePrincipal(principal);
            Decision decision = statusDenial(principal).orElse(Decision.deny(DenyReason.UNKNOWN_OPERATION));
            metrics.recordDecision(decision, Duration.ZERO);
            log.debug("Denied blank operation '{}:{}' for user {}", module, action, principal.userId());
            return decision;
        }
        return authorize(principal, Operation.of(module, action));
    }

    /**
     * Decides a request, blocking the caller until the decision is made or the lookup deadline
     * passes. If the calling thread is interrupted while waiting, the lookup is abandoned, the
     * interrupt flag is restored and the request is denied.
     */
    public Decision authorize(Principal principal, Operation operation) {
        CompletableFuture<Decision> pending = authorizeAsync(principal, operation);
        try {
            return pending.get();
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            log.debug("Interrupted while authorizing {} for user {}", operation, principal.userId());
            return Decision.deny(DenyReason.STORE_UNAVAILABLE);
        } catch (ExecutionException | CancellationException e) {
            log.warn("Authorization of {} for user {} did not complete", operation, principal.userId(), e);
            return Decision.deny(DenyReason.STORE_UNAVAILABLE);
        }
    }

    /**
     * Decides a request without blocking the caller.
     * <p>
     * The future always completes with a decision, at the latest when the lookup deadline passes.
     * Cancelling it interrupts the in-flight role store lookup; a cancelled request produces no
     * audit event.
     */
    public CompletableFuture<Decision> authorizeAsync(Principal principal, Operation operation) {
        requirePrincipal(principal);
        long started = System.nanoTime();

        Optional<Decision> early = precheck(principal, operation);
        if (early.isPresent()) {
            finish(principal, operation, early.get(), started);
            return CompletableFuture.completedFuture(early.get());
        }

        CompletableFuture<Decision> outcome = new CompletableFuture<>();
        Future<?> lookup;
        try {
            lookup = lookupExecutor.submit(() -> {
                outcome.complete(evaluate(principal, operation));
            });
        } catch (RejectedExecutionException e) {
            log.warn("Lookup executor rejected authorization of {} for user {}", operation, principal.userId());
            Decision denied = Decision.deny(DenyReason.STORE_UNAVAILABLE);
            finish(principal, operation, denied, started);
            return CompletableFuture.completedFuture(denied);
        }

        Decision timedOut = Decision.deny(DenyReason.STORE_UNAVAILABLE);
        outcome.completeOnTimeout(timedOut, lookupTimeout.toNanos(), TimeUnit.NANOSECONDS);

        // the caller's future completes only once metrics and audit are recorded
        CompletableFuture<Decision> result = outcome.whenComplete((decision, failure) -> {
            if (decision == timedOut) {
                lookup.cancel(true);
                log.warn("Role store lookup for {} (user {}) exceeded {}ms",
                        operation, principal.userId(), lookupTimeout.toMillis());
            }
            if (decision != null) {
                finish(principal, operation, decision, started);
            } else {
                log.debug("Authorization of {} for user {} was cancelled", operation, principal.userId());
            }
        });
        result.whenComplete((decision, failure) -> {
            if (result.isCancelled()) {
                outcome.cancel(true);
                lookup.cancel(true);
            }
        });
        return result;
    }

    /**
     * Every operation the principal currently holds. Inactive tenants or users, role store
     * failures and timeouts all yield {@link EffectivePermissions#none()}.
     */
    public EffectivePermissions effectivePermissions(Principal principal) {
        requirePrincipal(principal);
        if (statusDenial(principal).isPresent()) {
            return EffectivePermissions.none();
        }
        Future<EffectivePermissions> lookup;
        try {
            lookup = lookupExecutor.submit(() -> roleSource == RoleSource.STORE
                    ? resolver.resolveAll(principal.tenantId(), principal.userId())
                    : resolver.resolveAll(principal.tenantId(), principal.roleIds()));
        } catch (RejectedExecutionException e) {
            log.warn("Lookup executor rejected permission listing for user {}", principal.userId());
            return EffectivePermissions.none();
        }
        try {
            return lookup.get(lookupTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            lookup.cancel(true);
            log.warn("Permission listing for user {} exceeded {}ms", principal.userId(), lookupTimeout.toMillis());
            return EffectivePermissions.none();
        } catch (InterruptedException e) {
            lookup.cancel(true);
            Thread.currentThread().interrupt();
            return EffectivePermissions.none();
        } catch (ExecutionException e) {
            log.warn("Permission listing for user {} failed: {}", principal.userId(), e.getCause().getMessage());
            return EffectivePermissions.none();
        }
    }

    public PermissionCatalog catalog() {
        return catalog;
    }

    public RoleSource roleSource() {
        return roleSource;
    }

    private Optional<Decision> precheck(Principal principal, Operation operation) {
        Optional<Decision> status = statusDenial(principal);
        if (status.isPresent()) {
            return status;
        }
        if (!catalog.isValidOperation(operation)) {
            return Optional.of(Decision.deny(DenyReason.UNKNOWN_OPERATION));
        }
        return Optional.empty();
    }

    private static Optional<Decision> statusDenial(Principal principal) {
        if (!principal.tenantActive()) {
            return Optional.of(Decision.deny(DenyReason.TENANT_INACTIVE));
        }
        if (!principal.userActive()) {
            return Optional.of(Decision.deny(DenyReason.USER_INACTIVE));
        }
        return Optional.empty();
    }

    private Decision evaluate(Principal principal, Operation operation) {
        try {
            Optional<Scope> scope = roleSource == RoleSource.STORE
                    ? resolver.resolve(principal.tenantId(), principal.userId(), operation)
                    : resolver.resolve(principal.tenantId(), principal.roleIds(), operation);
            if (scope.isPresent()) {
                return Decision.allow(scope.get(), principal.userId());
            }
            return Decision.deny(DenyReason.NO_GRANT);
        } catch (RoleStoreException e) {
            log.warn("Role store unavailable ({}) while authorizing {} for user {}: {}",
                    e.lookup(), operation, principal.userId(), e.getMessage());
            return Decision.deny(DenyReason.STORE_UNAVAILABLE);
        } catch (RuntimeException e) {
            log.error("Unexpected failure while authorizing {} for user {}", operation, principal.userId(), e);
            return Decision.deny(DenyReason.STORE_UNAVAILABLE);
        }
    }

    private void finish(Principal principal, Operation operation, Decision decision, long startedNanos) {
        metrics.recordDecision(decision, Duration.ofNanos(System.nanoTime() - startedNanos));
        log.debug("{} {} for user {} in tenant {}: {}",
                decision.allowed() ? "Allowed" : "Denied", operation,
                principal.userId(), principal.tenantId(), decision);
        try {
            auditSink.emit(AuthorizationAuditEvent.of(principal, operation, decision, clock.instant()));
        } catch (RuntimeException e) {
            metrics.recordAuditDropped();
            log.warn("Audit emission failed for {} on {}", principal.userId(), operation, e);
        }
    }

    private static void requirePrincipal(Principal principal) {
        if (principal == null) {
            throw new IllegalArgumentException("principal must not be null");
        }
    }
}
