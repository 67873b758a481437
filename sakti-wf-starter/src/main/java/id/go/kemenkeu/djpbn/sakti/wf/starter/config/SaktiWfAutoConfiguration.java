package id.go.kemenkeu.djpbn.sakti.wf.starter.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditLog;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.JdbcAuditLog;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.AtomicStructuredFieldUpdater;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.StructuredFieldCodec;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.DistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.InMemoryLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.RedissonLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.StoreBackedDistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryExecutor;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicies;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicy;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job.JobWorkflowService;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket.TicketWorkflowService;
import id.go.kemenkeu.djpbn.sakti.wf.starter.aspect.ResourceLockAspect;
import id.go.kemenkeu.djpbn.sakti.wf.starter.health.LockStoreHealthIndicator;
import id.go.kemenkeu.djpbn.sakti.wf.starter.metrics.WorkflowMicrometerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Map;

@AutoConfiguration(afterName = {
    "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
    "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
    "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.MetricsAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(SaktiWfProperties.class)
public class SaktiWfAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SaktiWfAutoConfiguration.class);
    private final SaktiWfProperties properties;

    public SaktiWfAutoConfiguration(SaktiWfProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validateConfiguration() {
        log.info("═══════════════════════════════════════════════════════════");
        log.info("SAKTI Workflow Engine - Initializing...");
        log.info("═══════════════════════════════════════════════════════════");

        long ttl = properties.getLock().getTtlMs();
        long dbLockTimeout = properties.getDatabase().getLockTimeoutMs();
        if (dbLockTimeout <= 0) {
            throw new IllegalStateException("sakti.wf.database.lock-timeout-ms must be positive");
        }
        if (dbLockTimeout > ttl) {
            log.error("❌ CONFIG ERROR: database.lock-timeout-ms ({}) exceeds lock.ttl-ms ({})", dbLockTimeout, ttl);
            throw new IllegalStateException("sakti.wf.database.lock-timeout-ms (" + dbLockTimeout
                + ") must not exceed sakti.wf.lock.ttl-ms (" + ttl + ")");
        }
        if (properties.getLock().getBlockingTimeoutMs() < 0 || ttl < 1000) {
            throw new IllegalStateException("sakti.wf.lock.ttl-ms must be >= 1000 and blocking-timeout-ms >= 0");
        }
        if (!properties.getDragonfly().isEnabled()) {
            log.warn("Dragonfly disabled: mutual exclusion is process-local (in-memory lock store)");
        }

        logFeatureStatus("Dragonfly/Redis", properties.getDragonfly().isEnabled());
        logFeatureStatus("Audit Log", properties.getAudit().isEnabled());
        logFeatureStatus("Job Workflow", properties.getJob().isEnabled());
        logFeatureStatus("Ticket Workflow", properties.getTicket().isEnabled());
        logFeatureStatus("Declarative @ResourceLock", properties.getLock().isEnabled());
        logFeatureStatus("Observability Metrics", properties.getObservability().isMetricsEnabled());
        log.info("Lock TTL {}ms, blocking timeout {}ms, DB lock timeout {}ms",
            ttl, properties.getLock().getBlockingTimeoutMs(), dbLockTimeout);
        log.info("═══════════════════════════════════════════════════════════");
    }

    private void logFeatureStatus(String feature, boolean enabled) {
        log.info("{}: {}", feature, enabled ? "✓ ENABLED" : "○ DISABLED");
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CORE BEANS
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    @ConditionalOnMissingBean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean(RedissonClient.class)
    @ConditionalOnProperty(prefix = "sakti.wf.dragonfly", name = "enabled", havingValue = "true")
    public RedissonClient redissonClient() {
        SaktiWfProperties.Dragonfly dragonfly = properties.getDragonfly();
        Config config = new Config();
        config.useSingleServer()
                .setAddress(dragonfly.getUrl())
                .setPassword(dragonfly.getPassword().isEmpty() ? null : dragonfly.getPassword())
                .setConnectionPoolSize(dragonfly.getPool().getSize())
                .setConnectionMinimumIdleSize(dragonfly.getPool().getMinIdle())
                .setTimeout(dragonfly.getTimeout())
                .setConnectTimeout(dragonfly.getConnectTimeout())
                .setRetryAttempts(3)
                .setRetryInterval(1500);

        RedissonClient client = Redisson.create(config);
        log.info("✓ RedissonClient created");
        return client;
    }

    @Bean
    @ConditionalOnMissingBean(LockStore.class)
    public LockStore lockStore(@Autowired(required = false) RedissonClient redissonClient) {
        if (redissonClient != null) {
            log.info("✓ RedissonLockStore created");
            return new RedissonLockStore(redissonClient);
        }
        log.info("✓ InMemoryLockStore created");
        return new InMemoryLockStore();
    }

    @Bean
    @ConditionalOnMissingBean(DistributedMutex.class)
    public DistributedMutex distributedMutex(LockStore lockStore, WorkflowMetrics workflowMetrics) {
        return new StoreBackedDistributedMutex(lockStore, workflowMetrics,
            properties.getLock().getPollMinMs(), properties.getLock().getPollMaxMs());
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicies retryPolicies() {
        Map<RetryPolicyName, RetryPolicy> policies = new EnumMap<>(RetryPolicyName.class);
        for (RetryPolicyName name : RetryPolicyName.values()) {
            SaktiWfProperties.Retry.Policy p = properties.getRetry().get(name);
            RetryPolicy defaults = RetryPolicy.defaults(name);
            policies.put(name, new RetryPolicy(name, p.getMaxAttempts(), p.getBaseDelayMs(),
                p.getMaxDelayMs(), defaults.getRetryableKinds()));
        }
        return RetryPolicies.of(policies);
    }

    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(RetryPolicies retryPolicies, WorkflowMetrics workflowMetrics) {
        return new RetryExecutor(retryPolicies, workflowMetrics);
    }

    /**
     * The mapper is private to the codec and never registered as a bean.
     */
    @Bean
    @ConditionalOnMissingBean
    public StructuredFieldCodec structuredFieldCodec() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        log.info("✓ StructuredFieldCodec created (JSR-310 enabled)");
        return new StructuredFieldCodec(mapper);
    }

    @Bean
    @ConditionalOnMissingBean(AuditLog.class)
    @ConditionalOnProperty(prefix = "sakti.wf.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    @ConditionalOnBean(JdbcTemplate.class)
    public AuditLog auditLog(JdbcTemplate jdbcTemplate, StructuredFieldCodec structuredFieldCodec,
                             PlatformTransactionManager transactionManager) {
        log.info("✓ JdbcAuditLog created (table: {})", properties.getAudit().getTable());
        return new JdbcAuditLog(jdbcTemplate, structuredFieldCodec, properties.getAudit().getTable(),
            transactionManager);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({JdbcTemplate.class, PlatformTransactionManager.class})
    public WorkflowEngine workflowEngine(DistributedMutex distributedMutex,
                                         PlatformTransactionManager transactionManager,
                                         JdbcTemplate jdbcTemplate,
                                         WorkflowMetrics workflowMetrics,
                                         RetryExecutor retryExecutor,
                                         StructuredFieldCodec structuredFieldCodec,
                                         @Autowired(required = false) AuditLog auditLog) {
        log.info("✓ WorkflowEngine created");
        return WorkflowEngine.builder()
            .mutex(distributedMutex)
            .transactionManager(transactionManager)
            .jdbcTemplate(jdbcTemplate)
            .metrics(workflowMetrics)
            .retryExecutor(retryExecutor)
            .codec(structuredFieldCodec)
            .auditLog(auditLog)
            .keyPrefix(properties.getLock().getPrefix())
            .ttlMs(properties.getLock().getTtlMs())
            .blockingTimeoutMs(properties.getLock().getBlockingTimeoutMs())
            .databaseLockTimeoutMs(properties.getDatabase().getLockTimeoutMs())
            .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WorkflowEngine.class)
    public AtomicStructuredFieldUpdater atomicStructuredFieldUpdater(WorkflowEngine workflowEngine) {
        return workflowEngine.fieldUpdater();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WorkflowEngine.class)
    @ConditionalOnProperty(prefix = "sakti.wf.job", name = "enabled", havingValue = "true", matchIfMissing = true)
    public JobWorkflowService jobWorkflowService(WorkflowEngine workflowEngine) {
        return new JobWorkflowService(workflowEngine, JobWorkflowService.descriptor(properties.getJob().getTable()));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(WorkflowEngine.class)
    @ConditionalOnProperty(prefix = "sakti.wf.ticket", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TicketWorkflowService ticketWorkflowService(WorkflowEngine workflowEngine) {
        return new TicketWorkflowService(workflowEngine,
            TicketWorkflowService.descriptor(properties.getTicket().getTable()),
            properties.getTicket().getHistoryMaxLength());
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // ASPECT / HEALTH / METRICS
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    @ConditionalOnMissingBean(ResourceLockAspect.class)
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    @ConditionalOnProperty(prefix = "sakti.wf.lock", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ResourceLockAspect resourceLockAspect(DistributedMutex distributedMutex) {
        log.info("✓ ResourceLockAspect created");
        return new ResourceLockAspect(distributedMutex, properties);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    @ConditionalOnProperty(prefix = "sakti.wf.health", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(LockStoreHealthIndicator.class)
        public LockStoreHealthIndicator lockStoreHealthIndicator(LockStore lockStore, SaktiWfProperties properties) {
            return new LockStoreHealthIndicator(lockStore, properties);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    @ConditionalOnProperty(prefix = "sakti.wf.observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        @ConditionalOnMissingBean(WorkflowMicrometerMetrics.class)
        public WorkflowMicrometerMetrics workflowMicrometerMetrics(MeterRegistry registry, WorkflowMetrics workflowMetrics) {
            return new WorkflowMicrometerMetrics(registry, workflowMetrics);
        }
    }
}
