package com.atrium.authorization.testing;

import com.atrium.authorization.TenantStatus;
import com.atrium.authorization.UserStatus;
import com.atrium.authorization.store.RoleStoreException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Test fixtures")
class TestPrincipalFactoryTest {

    @Nested
    @DisplayName("TestPrincipalFactory")
    class Principals {

        @Test
        @DisplayName("create() gives an active user in an active tenant with no roles")
        void defaultPrincipal() {
            var principal = TestPrincipalFactory.create();

            assertThat(principal.tenantId()).isEqualTo(TestPrincipalFactory.DEFAULT_TENANT);
            assertThat(principal.userId()).isEqualTo(TestPrincipalFactory.DEFAULT_USER);
            assertThat(principal.roleIds()).isEmpty();
            assertThat(principal.tenantActive()).isTrue();
            assertThat(principal.userStatus()).isEqualTo(UserStatus.ACTIVE);
        }

        @Test
        @DisplayName("withRoles() carries the given role ids")
        void withRoles() {
            var principal = TestPrincipalFactory.withRoles("u1", "r-admin", "r-teacher");

            assertThat(principal.roleIds()).containsExactlyInAnyOrder("r-admin", "r-teacher");
            assertThat(principal.tenantId()).isEqualTo(TestPrincipalFactory.DEFAULT_TENANT);
        }

        @Test
        @DisplayName("inactiveTenant() marks only the tenant inactive")
        void inactiveTenant() {
            var principal = TestPrincipalFactory.inactiveTenant("t9", "u1");

            assertThat(principal.tenantStatus()).isEqualTo(TenantStatus.INACTIVE);
            assertThat(principal.userStatus()).isEqualTo(UserStatus.ACTIVE);
        }

        @Test
        @DisplayName("withUserStatus() keeps the tenant active")
        void userStatus() {
            var principal = TestPrincipalFactory.withUserStatus("u1", UserStatus.SUSPENDED);

            assertThat(principal.userStatus()).isEqualTo(UserStatus.SUSPENDED);
            assertThat(principal.tenantActive()).isTrue();
        }
    }

    @Nested
    @DisplayName("UnavailableRoleStore")
    class Unavailable {

        @Test
        @DisplayName("failing() throws on every lookup and counts the calls")
        void failing() {
            var store = UnavailableRoleStore.failing();

            assertThatThrownBy(() -> store.getRolesForUser("u1")).isInstanceOf(RoleStoreException.class);
            assertThatThrownBy(() -> store.getGrants("r1")).isInstanceOf(RoleStoreException.class);
            assertThat(store.calls()).isEqualTo(2);
        }

        @Test
        @DisplayName("hanging() blocks until released and then still fails")
        void hanging() throws Exception {
            var store = UnavailableRoleStore.hanging();
            var failure = new CompletableFuture<Throwable>();
            var caller = new Thread(() -> {
                try {
                    store.findRole("r1");
                } catch (RoleStoreException e) {
                    failure.complete(e);
                }
            });
            caller.start();

            store.awaitFirstCall();
            assertThat(failure).isNotDone();
            store.release();
            caller.join(5_000);

            assertThat(failure).isCompletedWithValueMatching(e -> e instanceof RoleStoreException);
            assertThat(store.interruptions()).isZero();
        }
    }

    @Nested
    @DisplayName("RecordingOwnershipFilter")
    class Ownership {

        @Test
        @DisplayName("records the owner it restricted the query to")
        void recordsOwner() {
            var filter = new RecordingOwnershipFilter();

            var query = filter.restrictToOwner("SELECT * FROM students", "u1");

            assertThat(query).isEqualTo("SELECT * FROM students WHERE owner = 'u1'");
            assertThat(filter.owners()).containsExactly("u1");
            assertThat(filter.wasApplied()).isTrue();
        }
    }
}
