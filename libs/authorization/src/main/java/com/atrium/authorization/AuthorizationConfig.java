package com.atrium.authorization;

import com.atrium.authorization.audit.AsyncAuditPublisher;
import com.atrium.authorization.audit.AuditSink;
import com.atrium.authorization.audit.LoggingAuditSink;
import com.atrium.authorization.store.CachingRoleStore;
import com.atrium.authorization.store.RetryingRoleStore;
import com.atrium.authorization.store.RoleStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring wiring for the authorization core.
 * <p>
 * The host application supplies exactly one {@link RoleStore} bean and, optionally, a
 * {@link MeterRegistry} and an {@link AuditSink}. Everything else is built here from
 * {@link AuthorizationProperties}:
 *
 * <ul>
 *   <li>the host store, wrapped with retries and then a TTL cache (each when enabled)
 *   <li>a lookup pool named {@link #LOOKUP_EXECUTOR_BEAN} with a bounded queue, shut down with the
 *       context; lookups beyond its capacity are refused and denied as store unavailable
 *   <li>an asynchronous audit publisher named {@link #AUDIT_SINK_BEAN}, delivering to the host's
 *       sink or to {@link LoggingAuditSink}
 * </ul>
 *
 * The decorated store is not registered as a {@link RoleStore} bean, so the host's store stays
 * the only autowiring candidate of that type. It is reachable through
 * {@link PermissionResolver#roleStore()}.
 */
@Configuration
@EnableConfigurationProperties(AuthorizationProperties.class)
public class AuthorizationConfig {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationConfig.class);

    /** Bean name of the role store lookup pool. */
    public static final String LOOKUP_EXECUTOR_BEAN = "authorizationLookupExecutor";

    /** Bean name of the sink the engine audits to. */
    public static final String AUDIT_SINK_BEAN = "authorizationAuditSink";

    @Bean
    public PermissionCatalog permissionCatalog(AuthorizationProperties properties) {
        PermissionCatalog catalog = properties.permissionCatalog();
        log.info("Permission catalog loaded: {} modules, {} operations",
                catalog.size(), catalog.operations().size());
        return catalog;
    }

    @Bean
    public AuthorizationMetrics authorizationMetrics(
            ObjectProvider<MeterRegistry> meterRegistry, AuthorizationProperties properties) {
        return new AuthorizationMetrics(meterRegistry.getIfUnique(SimpleMeterRegistry::new), properties.serviceName());
    }

    @Bean
    public PermissionResolver permissionResolver(
            PermissionCatalog catalog,
            RoleStore roleStore,
            AuthorizationMetrics metrics,
            AuthorizationProperties properties) {
        return new PermissionResolver(catalog, decorate(roleStore, properties, metrics), metrics);
    }

    @Bean(name = LOOKUP_EXECUTOR_BEAN, destroyMethod = "shutdownNow")
    public ExecutorService authorizationLookupExecutor(AuthorizationProperties properties) {
        int threads = properties.lookupThreads();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.lookupQueueCapacity()),
                lookupThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = AUDIT_SINK_BEAN)
    public AuditSink authorizationAuditSink(
            ListableBeanFactory beanFactory,
            AuthorizationMetrics metrics,
            AuthorizationProperties properties) {
        if (!properties.audit().enabled()) {
            log.info("Authorization audit disabled");
            return event -> { };
        }
        return AsyncAuditPublisher.start(hostAuditSink(beanFactory), properties.audit().queueCapacity(), metrics);
    }

    @Bean
    public AuthorizationEngine authorizationEngine(
            PermissionResolver resolver,
            @Qualifier(AUDIT_SINK_BEAN) AuditSink auditSink,
            AuthorizationMetrics metrics,
            @Qualifier(LOOKUP_EXECUTOR_BEAN) ExecutorService lookupExecutor,
            AuthorizationProperties properties) {
        return new AuthorizationEngine(
                resolver,
                auditSink,
                metrics,
                lookupExecutor,
                properties.lookupTimeout(),
                properties.roleSource(),
                Clock.systemUTC());
    }

    @Bean
    public PermissionCatalogService permissionCatalogService(
            AuthorizationEngine engine, AuthorizationProperties properties) {
        return new PermissionCatalogService(engine, properties.manageOperation());
    }

    @Bean
    public RouteAccessEvaluator routeAccessEvaluator(PermissionCatalog catalog, AuthorizationProperties properties) {
        return new RouteAccessEvaluator(properties.routeDeclarations(), catalog);
    }

    /**
     * Wraps the host store: retries innermost, so a cache miss is retried, and the cache outermost.
     */
    static RoleStore decorate(RoleStore roleStore, AuthorizationProperties properties, AuthorizationMetrics metrics) {
        RoleStore store = roleStore;
        AuthorizationProperties.Retry retry = properties.retry();
        if (retry.maxAttempts() > 1) {
            store = new RetryingRoleStore(store, retry.maxAttempts(), retry.backoff());
        }
        AuthorizationProperties.Cache cache = properties.cache();
        if (cache.enabled()) {
            store = new CachingRoleStore(store, cache.ttl(), cache.maximumSize(), Clock.systemUTC(), metrics);
        }
        return store;
    }

    private static AuditSink hostAuditSink(ListableBeanFactory beanFactory) {
        List<String> names = Arrays.stream(beanFactory.getBeanNamesForType(AuditSink.class))
                .filter(name -> !AUDIT_SINK_BEAN.equals(name))
                .toList();
        if (names.size() == 1) {
            return beanFactory.getBean(names.get(0), AuditSink.class);
        }
        if (names.size() > 1) {
            log.warn("Several AuditSink beans {}; auditing to the '{}' logger instead", names, LoggingAuditSink.LOGGER_NAME);
        }
        return new LoggingAuditSink();
    }

    private static ThreadFactory lookupThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "atrium-authz-lookup-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
