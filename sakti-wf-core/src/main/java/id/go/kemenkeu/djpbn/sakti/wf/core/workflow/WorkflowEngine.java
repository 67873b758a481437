package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditLog;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditRecorder;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.AtomicStructuredFieldUpdater;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.FieldShapeValidator;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.StructuredFieldCodec;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.DistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockKeys;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.RowLockRepository;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.VersionedRecordRepository;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryExecutor;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicies;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * The collaborators every workflow service shares, created once per process
 * and handed to each service.
 */
public final class WorkflowEngine {

    private final CriticalSectionExecutor criticalSection;
    private final RowLockRepository rowLocks;
    private final VersionedRecordRepository records;
    private final RetryExecutor retryExecutor;
    private final AuditRecorder auditRecorder;
    private final StructuredFieldCodec codec;
    private final FieldShapeValidator shapeValidator;
    private final WorkflowMetrics metrics;
    private final Clock clock;
    private final String keyPrefix;

    private WorkflowEngine(Builder b) {
        this.metrics = b.metrics != null ? b.metrics : new WorkflowMetrics();
        this.criticalSection = new CriticalSectionExecutor(b.mutex, b.transactionManager,
            metrics, b.ttlMs, b.blockingTimeoutMs,
            b.databaseLockTimeoutMs > 0 ? b.databaseLockTimeoutMs : b.ttlMs);
        this.rowLocks = new RowLockRepository(b.jdbcTemplate);
        this.records = new VersionedRecordRepository(b.jdbcTemplate);
        this.retryExecutor = b.retryExecutor != null ? b.retryExecutor
            : new RetryExecutor(b.retryPolicies != null ? b.retryPolicies : RetryPolicies.defaults(), metrics);
        this.auditRecorder = new AuditRecorder(b.auditLog, metrics);
        this.codec = b.codec != null ? b.codec : new StructuredFieldCodec();
        this.shapeValidator = new FieldShapeValidator();
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.keyPrefix = b.keyPrefix != null ? b.keyPrefix : LockKeys.DEFAULT_PREFIX;
    }

    public static Builder builder() {
        return new Builder();
    }

    public AtomicStructuredFieldUpdater fieldUpdater() {
        return new AtomicStructuredFieldUpdater(this);
    }

    public String lockKey(String resourceType, long resourceId) {
        return LockKeys.forResource(keyPrefix, resourceType, resourceId);
    }

    public CriticalSectionExecutor getCriticalSection() { return criticalSection; }
    public RowLockRepository getRowLocks() { return rowLocks; }
    public VersionedRecordRepository getRecords() { return records; }
    public RetryExecutor getRetryExecutor() { return retryExecutor; }
    public AuditRecorder getAuditRecorder() { return auditRecorder; }
    public StructuredFieldCodec getCodec() { return codec; }
    public FieldShapeValidator getShapeValidator() { return shapeValidator; }
    public WorkflowMetrics getMetrics() { return metrics; }
    public Clock getClock() { return clock; }
    public String getKeyPrefix() { return keyPrefix; }

    public static final class Builder {
        private DistributedMutex mutex;
        private PlatformTransactionManager transactionManager;
        private JdbcTemplate jdbcTemplate;
        private WorkflowMetrics metrics;
        private RetryPolicies retryPolicies;
        private RetryExecutor retryExecutor;
        private AuditLog auditLog;
        private StructuredFieldCodec codec;
        private Clock clock;
        private String keyPrefix;
        private long ttlMs = 15_000L;
        private long blockingTimeoutMs = 10_000L;
        private long databaseLockTimeoutMs;

        private Builder() {
        }

        public Builder mutex(DistributedMutex mutex) { this.mutex = mutex; return this; }
        public Builder transactionManager(PlatformTransactionManager tm) { this.transactionManager = tm; return this; }
        public Builder jdbcTemplate(JdbcTemplate jdbcTemplate) { this.jdbcTemplate = jdbcTemplate; return this; }
        public Builder metrics(WorkflowMetrics metrics) { this.metrics = metrics; return this; }
        public Builder retryPolicies(RetryPolicies retryPolicies) { this.retryPolicies = retryPolicies; return this; }
        public Builder retryExecutor(RetryExecutor retryExecutor) { this.retryExecutor = retryExecutor; return this; }
        public Builder auditLog(AuditLog auditLog) { this.auditLog = auditLog; return this; }
        public Builder codec(StructuredFieldCodec codec) { this.codec = codec; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder keyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; return this; }
        public Builder ttlMs(long ttlMs) { this.ttlMs = ttlMs; return this; }
        public Builder blockingTimeoutMs(long blockingTimeoutMs) { this.blockingTimeoutMs = blockingTimeoutMs; return this; }
        /** Defaults to the TTL. */
        public Builder databaseLockTimeoutMs(long databaseLockTimeoutMs) { this.databaseLockTimeoutMs = databaseLockTimeoutMs; return this; }

        public WorkflowEngine build() {
            if (jdbcTemplate == null) {
                throw new IllegalArgumentException("JdbcTemplate is required");
            }
            return new WorkflowEngine(this);
        }
    }
}
