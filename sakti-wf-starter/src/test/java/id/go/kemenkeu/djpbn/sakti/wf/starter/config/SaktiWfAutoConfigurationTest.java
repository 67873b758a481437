package id.go.kemenkeu.djpbn.sakti.wf.starter.config;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditLog;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.AtomicStructuredFieldUpdater;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.DistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.InMemoryLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryExecutor;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job.JobWorkflowService;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket.TicketWorkflowService;
import id.go.kemenkeu.djpbn.sakti.wf.starter.annotation.ResourceLock;
import id.go.kemenkeu.djpbn.sakti.wf.starter.aspect.ResourceLockAspect;
import id.go.kemenkeu.djpbn.sakti.wf.starter.health.LockStoreHealthIndicator;
import id.go.kemenkeu.djpbn.sakti.wf.starter.metrics.WorkflowMicrometerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RedissonClient;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SaktiWfAutoConfiguration")
class SaktiWfAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(AopAutoConfiguration.class, SaktiWfAutoConfiguration.class));

    @Configuration(proxyBeanMethods = false)
    static class DatabaseConfig {

        @Bean
        DataSource dataSource() {
            return new SimpleDriverDataSource(new org.h2.Driver(),
                "jdbc:h2:mem:starter_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1",
                "sa", "");
        }

        @Bean
        JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class MeterConfig {

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    public static class LockedService {

        private final LockStore lockStore;

        public LockedService(LockStore lockStore) {
            this.lockStore = lockStore;
        }

        @ResourceLock(key = "'order:' + #a0")
        public boolean isHeld(long orderId) {
            return lockStore.currentToken("workflow:order:" + orderId) != null;
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class LockedServiceConfig {

        @Bean
        LockedService lockedService(LockStore lockStore) {
            return new LockedService(lockStore);
        }
    }

    @Test
    @DisplayName("Database present: engine, services, audit, aspect and health are wired")
    void wiresEverythingWithDatabase() {
        runner.withUserConfiguration(DatabaseConfig.class).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(WorkflowEngine.class);
            assertThat(context).hasSingleBean(JobWorkflowService.class);
            assertThat(context).hasSingleBean(TicketWorkflowService.class);
            assertThat(context).hasSingleBean(AtomicStructuredFieldUpdater.class);
            assertThat(context).hasSingleBean(AuditLog.class);
            assertThat(context).hasSingleBean(ResourceLockAspect.class);
            assertThat(context).hasSingleBean(LockStoreHealthIndicator.class);
            assertThat(context.getBean(LockStore.class)).isInstanceOf(InMemoryLockStore.class);
            assertThat(context).doesNotHaveBean(RedissonClient.class);
            assertThat(context).doesNotHaveBean(WorkflowMicrometerMetrics.class);
        });
    }

    @Test
    @DisplayName("No database: lock and retry beans only")
    void withoutDatabase() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(DistributedMutex.class);
            assertThat(context).hasSingleBean(RetryExecutor.class);
            assertThat(context).doesNotHaveBean(WorkflowEngine.class);
            assertThat(context).doesNotHaveBean(AuditLog.class);
        });
    }

    @Test
    @DisplayName("Feature switches turn off audit and domain services")
    void featureSwitches() {
        runner.withUserConfiguration(DatabaseConfig.class)
            .withPropertyValues("sakti.wf.audit.enabled=false", "sakti.wf.ticket.enabled=false",
                "sakti.wf.lock.enabled=false", "sakti.wf.health.enabled=false")
            .run(context -> {
                assertThat(context).hasSingleBean(WorkflowEngine.class);
                assertThat(context).doesNotHaveBean(AuditLog.class);
                assertThat(context).doesNotHaveBean(TicketWorkflowService.class);
                assertThat(context).doesNotHaveBean(ResourceLockAspect.class);
                assertThat(context).doesNotHaveBean(LockStoreHealthIndicator.class);
                assertThat(context.getBean(WorkflowEngine.class).getAuditRecorder().isEnabled()).isFalse();
            });
    }

    @Test
    @DisplayName("Retry and lock properties reach the engine")
    void propertiesAreBound() {
        runner.withUserConfiguration(DatabaseConfig.class)
            .withPropertyValues("sakti.wf.retry.high-contention.max-attempts=12",
                "sakti.wf.lock.prefix=wf:", "sakti.wf.lock.ttl-ms=20000")
            .run(context -> {
                RetryExecutor retry = context.getBean(RetryExecutor.class);
                assertThat(retry.policy(RetryPolicyName.HIGH_CONTENTION).getMaxAttempts()).isEqualTo(12);
                WorkflowEngine engine = context.getBean(WorkflowEngine.class);
                assertThat(engine.lockKey("ticket", 7L)).isEqualTo("wf:ticket:7");
                assertThat(engine.getCriticalSection().getTtlMs()).isEqualTo(20000L);
            });
    }

    @Test
    @DisplayName("Database lock timeout bounds every critical-section transaction")
    void databaseLockTimeoutReachesTheEngine() {
        runner.withUserConfiguration(DatabaseConfig.class)
            .withPropertyValues("sakti.wf.lock.ttl-ms=15000", "sakti.wf.database.lock-timeout-ms=4000")
            .run(context -> {
                WorkflowEngine engine = context.getBean(WorkflowEngine.class);
                assertThat(engine.getCriticalSection().getDatabaseLockTimeoutMs()).isEqualTo(4000L);
                assertThat(engine.getCriticalSection().transactionTimeoutSeconds()).isEqualTo(4);
            });
    }

    @Test
    @DisplayName("Database lock timeout longer than the lock lease fails startup")
    void rejectsLockTimeoutAboveTtl() {
        runner.withPropertyValues("sakti.wf.lock.ttl-ms=5000", "sakti.wf.database.lock-timeout-ms=10000")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Meter registry present: workflow gauges are registered")
    void registersGauges() {
        runner.withUserConfiguration(MeterConfig.class).run(context -> {
            assertThat(context).hasSingleBean(WorkflowMicrometerMetrics.class);
            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.find("sakti_wf_transitions_total").tag("outcome", "applied").gauge()).isNotNull();
            assertThat(registry.find("sakti_wf_lock_total").tag("result", "timeout").gauge()).isNotNull();
        });
    }

    @Test
    @DisplayName("Registry from the actuator metrics auto-configuration gets the workflow gauges")
    void registersGaugesOnActuatorRegistry() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SaktiWfAutoConfiguration.class,
                MetricsAutoConfiguration.class, SimpleMetricsExportAutoConfiguration.class,
                CompositeMeterRegistryAutoConfiguration.class))
            .run(context -> {
                assertThat(context).hasNotFailed();
                assertThat(context).hasSingleBean(WorkflowMicrometerMetrics.class);
                MeterRegistry registry = context.getBean(MeterRegistry.class);
                assertThat(registry.find("sakti_wf_retries_total").tag("result", "exhausted").gauge()).isNotNull();
            });
    }

    @Test
    @DisplayName("@ResourceLock methods run under the distributed mutex")
    void aspectIsApplied() {
        runner.withUserConfiguration(LockedServiceConfig.class).run(context -> {
            LockedService service = context.getBean(LockedService.class);
            assertThat(service.isHeld(42L)).isTrue();
            assertThat(context.getBean(LockStore.class).currentToken("workflow:order:42")).isNull();
        });
    }
}
