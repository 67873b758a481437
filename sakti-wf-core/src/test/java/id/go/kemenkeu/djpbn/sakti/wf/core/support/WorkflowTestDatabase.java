package id.go.kemenkeu.djpbn.sakti.wf.core.support;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.JdbcAuditLog;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.StructuredFieldCodec;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.InMemoryLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.StoreBackedDistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import java.util.UUID;

/**
 * Fresh in-memory H2 database with the job, ticket and audit tables, plus an
 * engine wired against it with an in-process lock store.
 */
public final class WorkflowTestDatabase {

    private final SimpleDriverDataSource dataSource;
    private final JdbcTemplate jdbcTemplate;
    private final DataSourceTransactionManager transactionManager;
    private final WorkflowMetrics metrics = new WorkflowMetrics();
    private final StructuredFieldCodec codec = new StructuredFieldCodec();
    private final InMemoryLockStore lockStore = new InMemoryLockStore();

    private WorkflowTestDatabase() {
        String url = "jdbc:h2:mem:wf_" + UUID.randomUUID().toString().replace("-", "")
            + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=5000";
        this.dataSource = new SimpleDriverDataSource(new org.h2.Driver(), url, "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("db/workflow-schema.sql")).execute(dataSource);
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.transactionManager = new DataSourceTransactionManager(dataSource);
    }

    public static WorkflowTestDatabase create() {
        return new WorkflowTestDatabase();
    }

    public WorkflowEngine.Builder engineBuilder() {
        return WorkflowEngine.builder()
            .mutex(new StoreBackedDistributedMutex(lockStore, metrics, 1, 5))
            .transactionManager(transactionManager)
            .jdbcTemplate(jdbcTemplate)
            .metrics(metrics)
            .codec(codec)
            .auditLog(new JdbcAuditLog(jdbcTemplate, codec, "workflow_audit_log", transactionManager))
            .ttlMs(15000)
            .blockingTimeoutMs(20000);
    }

    public WorkflowEngine engine() {
        return engineBuilder().build();
    }

    public void insertJob(long id, String identifier, String status, Long parentId) {
        jdbcTemplate.update("INSERT INTO job (id, identifier, status, parent_id) VALUES (?, ?, ?, ?)",
            id, identifier, status, parentId);
    }

    public void insertTicket(long id, String status, int level) {
        jdbcTemplate.update("INSERT INTO ticket (id, status, level) VALUES (?, ?, ?)", id, status, level);
    }

    public long auditCount(String resourceType, long resourceId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM workflow_audit_log WHERE resource_type = ? AND resource_id = ?",
            Long.class, resourceType, resourceId);
        return count != null ? count : 0L;
    }

    public JdbcTemplate getJdbcTemplate() { return jdbcTemplate; }
    public DataSourceTransactionManager getTransactionManager() { return transactionManager; }
    public WorkflowMetrics getMetrics() { return metrics; }
    public StructuredFieldCodec getCodec() { return codec; }
    public InMemoryLockStore getLockStore() { return lockStore; }
}
