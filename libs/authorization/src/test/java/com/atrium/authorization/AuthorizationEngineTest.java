package com.atrium.authorization;

import com.atrium.authorization.store.InMemoryRoleStore;
import com.atrium.authorization.store.RoleDefinition;
import com.atrium.authorization.store.RoleStore;
import com.atrium.authorization.testing.RecordingAuditSink;
import com.atrium.authorization.testing.TestPrincipalFactory;
import com.atrium.authorization.testing.UnavailableRoleStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@DisplayName("AuthorizationEngine")
class AuthorizationEngineTest {

    private static final String TENANT = "t1";
    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");
    private static final Operation STUDENTS_READ = Operation.of("students", "read");
    private static final Operation STUDENTS_DELETE = Operation.of("students", "delete");

    private ExecutorService executor;
    private SimpleMeterRegistry registry;
    private AuthorizationMetrics metrics;
    private RecordingAuditSink audit;
    private InMemoryRoleStore store;
    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        registry = new SimpleMeterRegistry();
        metrics = new AuthorizationMetrics(registry, "test");
        audit = new RecordingAuditSink();
        store = new InMemoryRoleStore()
                .putTenant(TENANT, TenantStatus.ACTIVE)
                .putTenant("t2", TenantStatus.ACTIVE)
                .putRole(RoleDefinition.tenantRole("r-teacher", TENANT, "Teacher"))
                .putRole(RoleDefinition.systemRole("r-admin", "Admin"))
                .grant("r-teacher", "students", "read", Scope.OWN)
                .grant("r-admin", "students", "read", Scope.FULL)
                .grant("r-admin", "students", "delete", Scope.FULL);
        engine = engine(store, Duration.ofSeconds(2), RoleSource.STORE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AuthorizationEngine engine(RoleStore roleStore, Duration timeout, RoleSource source) {
        var resolver = new PermissionResolver(PermissionCatalog.defaults(), roleStore, metrics);
        return new AuthorizationEngine(resolver, audit, metrics, executor, timeout, source,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static Principal user(String userId) {
        return TestPrincipalFactory.create(TENANT, userId);
    }

    @Nested
    @DisplayName("school scenarios")
    class Scenarios {

        @Test
        @DisplayName("a teacher reads own students and cannot delete them")
        void teacher() {
            store.assign("u-teacher", "r-teacher");

            assertThat(engine.authorize(user("u-teacher"), "students", "read"))
                    .isEqualTo(Decision.allow(Scope.OWN, "u-teacher"));
            assertThat(engine.authorize(user("u-teacher"), "students", "delete"))
                    .isEqualTo(Decision.deny(DenyReason.NO_GRANT));
        }

        @Test
        @DisplayName("an admin system role dominates a teacher role held alongside it")
        void admin() {
            store.assign("u-admin", "r-teacher").assign("u-admin", "r-admin");

            assertThat(engine.authorize(user("u-admin"), STUDENTS_READ))
                    .isEqualTo(Decision.allow(Scope.FULL, "u-admin"));
            assertThat(engine.authorize(user("u-admin"), STUDENTS_DELETE))
                    .isEqualTo(Decision.allow(Scope.FULL, "u-admin"));
        }

        @Test
        @DisplayName("an own decision hands the data layer an owner filter")
        void ownFilter() {
            store.assign("u-teacher", "r-teacher");

            var decision = (Decision.Allow) engine.authorize(user("u-teacher"), STUDENTS_READ);

            assertThat(decision.scopeFilter()).isEqualTo(ScopeFilter.own("u-teacher"));
        }
    }

    @Nested
    @DisplayName("denials")
    class Denials {

        @Test
        @DisplayName("a user with no roles is denied every catalog operation")
        void noRoles() {
            for (Operation op : PermissionCatalog.defaults().operations()) {
                assertThat(engine.authorize(user("u-none"), op)).isEqualTo(Decision.deny(DenyReason.NO_GRANT));
            }
        }

        @Test
        @DisplayName("operations outside the catalog are denied even with a matching grant")
        void unknownOperation() {
            store.grant("r-admin", "payroll_v2", "read", Scope.FULL).assign("u-admin", "r-admin");

            assertThat(engine.authorize(user("u-admin"), "payroll_v2", "read"))
                    .isEqualTo(Decision.deny(DenyReason.UNKNOWN_OPERATION));
        }

        @Test
        @DisplayName("blank module or action is an unknown operation")
        void blankOperation() {
            assertThat(engine.authorize(user("u-1"), "", "read"))
                    .isEqualTo(Decision.deny(DenyReason.UNKNOWN_OPERATION));
            assertThat(engine.authorize(user("u-1"), "students", null))
                    .isEqualTo(Decision.deny(DenyReason.UNKNOWN_OPERATION));
        }

        @Test
        @DisplayName("an inactive tenant denies every call, known operation or not")
        void inactiveTenant() {
            store.assign("u-admin", "r-admin");
            var principal = TestPrincipalFactory.inactiveTenant(TENANT, "u-admin");

            assertThat(engine.authorize(principal, STUDENTS_READ))
                    .isEqualTo(Decision.deny(DenyReason.TENANT_INACTIVE));
            assertThat(engine.authorize(principal, "payroll_v2", "read"))
                    .isEqualTo(Decision.deny(DenyReason.TENANT_INACTIVE));
        }

        @Test
        @DisplayName("inactive and suspended users are denied")
        void inactiveUser() {
            store.assign("u-teacher", "r-teacher");
            for (UserStatus status : List.of(UserStatus.INACTIVE, UserStatus.SUSPENDED)) {
                var principal = new Principal(TENANT, "u-teacher", null, TenantStatus.ACTIVE, status);
                assertThat(engine.authorize(principal, STUDENTS_READ))
                        .isEqualTo(Decision.deny(DenyReason.USER_INACTIVE));
            }
        }

        @Test
        @DisplayName("a role of another tenant grants nothing")
        void tenantIsolation() {
            store.putRole(RoleDefinition.tenantRole("r-teacher-t2", "t2", "Teacher"))
                    .grant("r-teacher-t2", "students", "delete", Scope.FULL)
                    .assign("u-teacher", "r-teacher-t2");

            assertThat(engine.authorize(user("u-teacher"), STUDENTS_DELETE))
                    .isEqualTo(Decision.deny(DenyReason.NO_GRANT));
        }

        @Test
        @DisplayName("a null principal is a programming error")
        void nullPrincipal() {
            assertThatThrownBy(() -> engine.authorize(null, STUDENTS_READ))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("system roles")
    class SystemRoles {

        @Test
        @DisplayName("grant the same scope under every tenant")
        void portable() {
            store.assign("u-admin", "r-admin");

            var inT1 = engine.authorize(TestPrincipalFactory.create(TENANT, "u-admin"), STUDENTS_DELETE);
            var inT2 = engine.authorize(TestPrincipalFactory.create("t2", "u-admin"), STUDENTS_DELETE);

            assertThat(inT1).isEqualTo(inT2).isEqualTo(Decision.allow(Scope.FULL, "u-admin"));
        }
    }

    @Nested
    @DisplayName("fail closed")
    class FailClosed {

        @Test
        @DisplayName("a failing role store yields store_unavailable")
        void storeFailure() {
            var failing = engine(UnavailableRoleStore.failing(), Duration.ofSeconds(2), RoleSource.STORE);

            var decision = failing.authorize(user("u-1"), STUDENTS_READ);

            assertThat(decision).isEqualTo(Decision.deny(DenyReason.STORE_UNAVAILABLE));
            assertThat(((Decision.Deny) decision).reason().isDependencyFailure()).isTrue();
        }

        @Test
        @DisplayName("a lookup past the deadline is denied and interrupted")
        void timeout() {
            var hanging = UnavailableRoleStore.hanging();
            var slow = engine(hanging, Duration.ofMillis(100), RoleSource.STORE);

            var decision = slow.authorize(user("u-1"), STUDENTS_READ);

            assertThat(decision).isEqualTo(Decision.deny(DenyReason.STORE_UNAVAILABLE));
            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                    assertThat(hanging.interruptions()).isEqualTo(1));
            assertThat(audit.last().reason()).isEqualTo("store_unavailable");
        }

        @Test
        @DisplayName("a shut-down lookup pool yields store_unavailable")
        void rejectedExecution() {
            store.assign("u-admin", "r-admin");
            executor.shutdown();

            assertThat(engine.authorize(user("u-admin"), STUDENTS_READ))
                    .isEqualTo(Decision.deny(DenyReason.STORE_UNAVAILABLE));
        }

        @Test
        @DisplayName("an interrupted caller is denied and keeps its interrupt flag")
        void interruptedCaller() {
            var slow = engine(UnavailableRoleStore.hanging(), Duration.ofSeconds(10), RoleSource.STORE);

            Thread.currentThread().interrupt();
            Decision decision;
            boolean stillInterrupted;
            try {
                decision = slow.authorize(user("u-1"), STUDENTS_READ);
            } finally {
                stillInterrupted = Thread.interrupted();
            }

            assertThat(decision).isEqualTo(Decision.deny(DenyReason.STORE_UNAVAILABLE));
            assertThat(stillInterrupted).isTrue();
        }
    }

    @Nested
    @DisplayName("authorizeAsync()")
    class Async {

        @Test
        @DisplayName("completes with the same decision as the blocking call")
        void sameDecision() throws Exception {
            store.assign("u-teacher", "r-teacher");

            assertThat(engine.authorizeAsync(user("u-teacher"), STUDENTS_READ).get())
                    .isEqualTo(engine.authorize(user("u-teacher"), STUDENTS_READ));
        }

        @Test
        @DisplayName("cancelling the future interrupts the lookup and skips the audit")
        void cancellation() throws Exception {
            var hanging = UnavailableRoleStore.hanging();
            var slow = engine(hanging, Duration.ofSeconds(10), RoleSource.STORE);

            CompletableFuture<Decision> pending = slow.authorizeAsync(user("u-1"), STUDENTS_READ);
            hanging.awaitFirstCall();
            pending.cancel(true);

            await().atMost(Duration.ofSeconds(5)).untilAsserted(() ->
                    assertThat(hanging.interruptions()).isEqualTo(1));
            assertThat(pending.isCancelled()).isTrue();
            assertThat(audit.events()).isEmpty();
        }

        @Test
        @DisplayName("concurrent requests all see the same decision")
        void concurrent() {
            store.assign("u-teacher", "r-teacher");
            List<CompletableFuture<Decision>> pending = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                pending.add(engine.authorizeAsync(user("u-teacher"), STUDENTS_READ));
            }

            assertThat(pending).extracting(CompletableFuture::join)
                    .containsOnly(Decision.allow(Scope.OWN, "u-teacher"));
        }
    }

    @Nested
    @DisplayName("role source")
    class RoleSources {

        @Test
        @DisplayName("PRINCIPAL evaluates the role ids carried by the principal")
        void principalRoles() {
            var fromToken = engine(store, Duration.ofSeconds(2), RoleSource.PRINCIPAL);
            var principal = TestPrincipalFactory.inTenant(TENANT, "u-unassigned", "r-teacher");

            assertThat(fromToken.authorize(principal, STUDENTS_READ))
                    .isEqualTo(Decision.allow(Scope.OWN, "u-unassigned"));
            assertThat(engine.authorize(principal, STUDENTS_READ))
                    .isEqualTo(Decision.deny(DenyReason.NO_GRANT));
        }

        @Test
        @DisplayName("STORE reflects a revoked assignment on the next call")
        void storeIsAuthoritative() {
            store.assign("u-teacher", "r-teacher");
            assertThat(engine.authorize(user("u-teacher"), STUDENTS_READ).allowed()).isTrue();

            store.unassign("u-teacher", "r-teacher");

            assertThat(engine.authorize(user("u-teacher"), STUDENTS_READ).allowed()).isFalse();
        }
    }

    @Nested
    @DisplayName("side effects")
    class SideEffects {

        @Test
        @DisplayName("emits one audit event per decision")
        void auditsDecisions() {
            store.assign("u-teacher", "r-teacher");

            engine.authorize(user("u-teacher"), STUDENTS_READ);
            engine.authorize(user("u-teacher"), STUDENTS_DELETE);

            assertThat(audit.events()).hasSize(2);
            var allow = audit.events().get(0);
            assertThat(allow.tenantId()).isEqualTo(TENANT);
            assertThat(allow.userId()).isEqualTo("u-teacher");
            assertThat(allow.outcome()).isEqualTo("allow");
            assertThat(allow.scope()).isEqualTo("own");
            assertThat(allow.timestamp()).isEqualTo(NOW);
            assertThat(audit.last().reason()).isEqualTo("no_grant");
        }

        @Test
        @DisplayName("a failing audit sink never changes the decision")
        void auditFailureIgnored() {
            store.assign("u-teacher", "r-teacher");
            var resolver = new PermissionResolver(PermissionCatalog.defaults(), store, metrics);
            var withBrokenAudit = new AuthorizationEngine(resolver, RecordingAuditSink.failing(), metrics,
                    executor, Duration.ofSeconds(2), RoleSource.STORE, Clock.systemUTC());

            assertThat(withBrokenAudit.authorize(user("u-teacher"), STUDENTS_READ))
                    .isEqualTo(Decision.allow(Scope.OWN, "u-teacher"));
            assertThat(registry.get(AuthorizationMetrics.AUDIT_DROPPED).counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("counts decisions by outcome")
        void countsDecisions() {
            store.assign("u-teacher", "r-teacher");

            engine.authorize(user("u-teacher"), STUDENTS_READ);
            engine.authorize(user("u-teacher"), STUDENTS_DELETE);

            assertThat(registry.get(AuthorizationMetrics.DECISIONS).tag("outcome", "allow").counter().count())
                    .isEqualTo(1.0);
            assertThat(registry.get(AuthorizationMetrics.DECISIONS).tag("detail", "no_grant").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("effectivePermissions()")
    class Effective {

        @Test
        @DisplayName("lists what an active user holds")
        void listsPermissions() {
            store.assign("u-teacher", "r-teacher");

            var permissions = engine.effectivePermissions(user("u-teacher"));

            assertThat(permissions.scopes()).containsOnlyKeys(STUDENTS_READ);
            assertThat(permissions.actionsByModule()).containsEntry("students", List.of("read"));
        }

        @Test
        @DisplayName("is empty for an inactive tenant")
        void inactiveTenant() {
            store.assign("u-admin", "r-admin");
            assertThat(engine.effectivePermissions(TestPrincipalFactory.inactiveTenant(TENANT, "u-admin")).isEmpty())
                    .isTrue();
        }

        @Test
        @DisplayName("is empty when the role store fails")
        void storeFailure() {
            var failing = engine(UnavailableRoleStore.failing(), Duration.ofSeconds(2), RoleSource.STORE);
            assertThat(failing.effectivePermissions(user("u-1")).isEmpty()).isTrue();
        }
    }

    @Test
    @DisplayName("rejects a non-positive lookup timeout")
    void validatesTimeout() {
        var resolver = new PermissionResolver(PermissionCatalog.defaults(), store, metrics);
        assertThatThrownBy(() -> new AuthorizationEngine(resolver, audit, metrics, executor,
                Duration.ZERO, RoleSource.STORE, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects a lookup timeout shorter than a millisecond")
    void validatesSubMillisecondTimeout() {
        var resolver = new PermissionResolver(PermissionCatalog.defaults(), store, metrics);
        assertThatThrownBy(() -> new AuthorizationEngine(resolver, audit, metrics, executor,
                Duration.ofNanos(999_999), RoleSource.STORE, Clock.systemUTC()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least");

        assertThat(new AuthorizationEngine(resolver, audit, metrics, executor,
                AuthorizationEngine.MIN_LOOKUP_TIMEOUT, RoleSource.STORE, Clock.systemUTC()).catalog())
                .isSameAs(PermissionCatalog.defaults());
    }
}
