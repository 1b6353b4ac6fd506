package com.atrium.authorization.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Retries failed lookups of another {@link RoleStore} a bounded number of times.
 * <p>
 * Only {@link RoleStoreException} is retried. The delay grows linearly with the attempt number
 * ({@code backoff}, {@code 2 * backoff}, ...). An interrupt during the delay stops retrying
 * immediately: the interrupt flag is restored and the lookup fails with a
 * {@link RoleStoreException}.
 */
public final class RetryingRoleStore implements RoleStore {

    private static final Logger log = LoggerFactory.getLogger(RetryingRoleStore.class);

    private final RoleStore delegate;
    private final int maxAttempts;
    private final Duration backoff;

    /**
     * @param delegate    the store to call
     * @param maxAttempts total attempts per lookup, at least 1
     * @param backoff     base delay between attempts, zero for none
     */
    public RetryingRoleStore(RoleStore delegate, int maxAttempts, Duration backoff) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate must not be null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("backoff must not be null or negative");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    @Override
    public Set<String> getRolesForUser(String userId) {
        return withRetry("getRolesForUser", () -> delegate.getRolesForUser(userId));
    }

    @Override
    public Optional<RoleDefinition> findRole(String roleId) {
        return withRetry("findRole", () -> delegate.findRole(roleId));
    }

    @Override
    public Set<PermissionGrant> getGrants(String roleId) {
        return withRetry("getGrants", () -> delegate.getGrants(roleId));
    }

    @Override
    public boolean isRoleActive(String roleId) {
        return withRetry("isRoleActive", () -> delegate.isRoleActive(roleId));
    }

    private <T> T withRetry(String lookup, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RoleStoreException e) {
                if (attempt >= maxAttempts) {
                    log.warn("Role store {} failed after {} attempts: {}", lookup, attempt, e.getMessage());
                    throw e;
                }
                long delayMs = backoff.toMillis() * attempt;
                log.debug("Role store {} attempt {} failed ({}), retrying in {}ms",
                        lookup, attempt, e.getMessage(), delayMs);
                pause(lookup, delayMs, e);
            }
        }
    }

    private static void pause(String lookup, long delayMs, RoleStoreException failure) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            RoleStoreException interrupted =
                    new RoleStoreException(lookup, "Interrupted while retrying " + lookup, ie);
            interrupted.addSuppressed(failure);
            throw interrupted;
        }
    }
}
