package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.stream.Stream;

/**
 * Front for {@link AuditLog} used after a critical section has finished.
 * A failed append is logged and counted but never thrown: the business
 * change it describes has already committed or rolled back.
 */
public class AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(AuditRecorder.class);

    private final AuditLog auditLog;
    private final WorkflowMetrics metrics;

    public AuditRecorder(AuditLog auditLog, WorkflowMetrics metrics) {
        this.auditLog = auditLog;
        this.metrics = metrics != null ? metrics : new WorkflowMetrics();
    }

    public void record(AuditEntry entry) {
        if (auditLog == null) {
            log.debug("Audit disabled, dropping {}", entry);
            return;
        }
        try {
            auditLog.append(entry);
        } catch (RuntimeException e) {
            metrics.recordAuditWriteFailure();
            log.error("AUDIT WRITE FAILED for {} {} ({} {}) correlationId={}",
                entry.getResourceType(), entry.getResourceId(), entry.getOperation(),
                entry.getOutcome(), entry.getCorrelationId(), e);
        }
    }

    public Stream<AuditEntry> history(String resourceType, long resourceId, Instant since) {
        if (auditLog == null) {
            return Stream.empty();
        }
        return auditLog.query(resourceType, resourceId, since);
    }

    public boolean isEnabled() {
        return auditLog != null;
    }
}
