package com.atrium.authorization.testing;

import com.atrium.authorization.store.PermissionGrant;
import com.atrium.authorization.store.RoleDefinition;
import com.atrium.authorization.store.RoleStore;
import com.atrium.authorization.store.RoleStoreException;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link RoleStore} simulating an unreachable backend.
 * <p>
 * In {@link Mode#FAILING} mode every call throws {@link RoleStoreException}. In
 * {@link Mode#HANGING} mode every call blocks until released or interrupted, which lets tests
 * drive lookup timeouts and cancellation; an interrupted call throws {@link RoleStoreException}
 * and is recorded in {@link #interruptions()}.
 */
public final class UnavailableRoleStore implements RoleStore {

    public enum Mode {
        FAILING,
        HANGING
    }

    private final Mode mode;
    private final CountDownLatch release = new CountDownLatch(1);
    private final CountDownLatch entered = new CountDownLatch(1);
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger interruptions = new AtomicInteger();

    private UnavailableRoleStore(Mode mode) {
        this.mode = mode;
    }

    public static UnavailableRoleStore failing() {
        return new UnavailableRoleStore(Mode.FAILING);
    }

    public static UnavailableRoleStore hanging() {
        return new UnavailableRoleStore(Mode.HANGING);
    }

    @Override
    public Set<String> getRolesForUser(String userId) {
        unavailable("getRolesForUser");
        return Set.of();
    }

    @Override
    public Optional<RoleDefinition> findRole(String roleId) {
        unavailable("findRole");
        return Optional.empty();
    }

    @Override
    public Set<PermissionGrant> getGrants(String roleId) {
        unavailable("getGrants");
        return Set.of();
    }

    @Override
    public boolean isRoleActive(String roleId) {
        unavailable("isRoleActive");
        return false;
    }

    /** Lets hanging calls return, after which they still fail. */
    public void release() {
        release.countDown();
    }

    /** Blocks until the first call has reached the store. */
    public void awaitFirstCall() throws InterruptedException {
        entered.await();
    }

    public int calls() {
        return calls.get();
    }

    public int interruptions() {
        return interruptions.get();
    }

    public Mode mode() {
        return mode;
    }

    private void unavailable(String lookup) {
        calls.incrementAndGet();
        entered.countDown();
        if (mode == Mode.HANGING) {
            try {
                release.await();
            } catch (InterruptedException e) {
                interruptions.incrementAndGet();
                Thread.currentThread().interrupt();
                throw new RoleStoreException(lookup, "interrupted while waiting for the role store", e);
            }
        }
        throw new RoleStoreException(lookup, "role store unavailable");
    }
}
