package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowSecurityException;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.support.WorkflowTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

@DisplayName("JdbcAuditLog")
class JdbcAuditLogTest {

    private WorkflowTestDatabase db;
    private JdbcAuditLog auditLog;

    @BeforeEach
    void setUp() {
        db = WorkflowTestDatabase.create();
        auditLog = new JdbcAuditLog(db.getJdbcTemplate(), db.getCodec(), "workflow_audit_log",
            db.getTransactionManager());
    }

    private AuditEntry entry(long resourceId, String operation, Instant at) {
        return AuditEntry.builder()
            .resourceType("ticket")
            .resourceId(resourceId)
            .operation(operation)
            .outcome(AuditOutcome.APPLIED)
            .oldValue(Collections.<String, Object>singletonMap("level", 0))
            .newValue(Collections.<String, Object>singletonMap("level", 1))
            .actor("tester")
            .lockWaitMs(3)
            .txDurationMs(7)
            .correlationId("cid-" + operation)
            .timestamp(at)
            .build();
    }

    @Test
    @DisplayName("Entries come back oldest first across several pages")
    void pagesInOrder() {
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 25; i++) {
            auditLog.append(entry(7L, "op" + i, base.plusSeconds(i)));
        }
        auditLog.append(entry(8L, "other", base));

        List<String> operations;
        try (Stream<AuditEntry> history = auditLog.query("ticket", 7L, null, 10)) {
            operations = history.map(AuditEntry::getOperation).collect(Collectors.toList());
        }

        assertThat(operations).hasSize(25);
        assertThat(operations.get(0)).isEqualTo("op0");
        assertThat(operations.get(24)).isEqualTo("op24");
    }

    @Test
    @DisplayName("Since bound is inclusive")
    void sinceFilter() {
        Instant base = Instant.parse("2026-01-01T00:00:00Z");
        for (int i = 0; i < 5; i++) {
            auditLog.append(entry(7L, "op" + i, base.plusSeconds(i)));
        }

        List<AuditEntry> recent = auditLog.query("ticket", 7L, base.plusSeconds(3)).collect(Collectors.toList());

        assertThat(recent).extracting(AuditEntry::getOperation).containsExactly("op3", "op4");
    }

    @Test
    @DisplayName("Stored entries keep their values and error kind")
    void roundTripsFields() {
        auditLog.append(AuditEntry.builder()
            .resourceType("job")
            .resourceId(1L)
            .operation("transition")
            .outcome(AuditOutcome.REJECTED)
            .errorKind(ErrorKind.INVALID_TRANSITION)
            .correlationId("cid-x")
            .build());

        AuditEntry stored = auditLog.query("job", 1L, null).findFirst().orElseThrow(IllegalStateException::new);

        assertThat(stored.getSequence()).isNotNull();
        assertThat(stored.getOutcome()).isEqualTo(AuditOutcome.REJECTED);
        assertThat(stored.getErrorKind()).isEqualTo(ErrorKind.INVALID_TRANSITION);
        assertThat(stored.getOldValue()).isNull();
        assertThat(stored.getCorrelationId()).isEqualTo("cid-x");
    }

    @Test
    @DisplayName("Appends survive a rollback of the caller's transaction")
    void appendIsIndependentOfCallerTransaction() {
        TransactionTemplate tx = new TransactionTemplate(db.getTransactionManager());
        assertThatThrownBy(() -> tx.executeWithoutResult(status -> {
            auditLog.append(entry(9L, "inside", Instant.now()));
            throw new IllegalStateException("business failure");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(db.auditCount("ticket", 9L)).isEqualTo(1L);
    }

    @Test
    @DisplayName("Audit write failures are logged and counted, never thrown")
    void recorderSwallowsAndCounts() {
        AuditLog broken = mock(AuditLog.class);
        doThrow(new IllegalStateException("disk full")).when(broken).append(any(AuditEntry.class));
        WorkflowMetrics metrics = new WorkflowMetrics();
        AuditRecorder recorder = new AuditRecorder(broken, metrics);

        recorder.record(entry(1L, "op", Instant.now()));

        assertThat(metrics.getAuditWriteFailures()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Disabled audit yields empty history")
    void disabledAudit() {
        AuditRecorder recorder = new AuditRecorder(null, new WorkflowMetrics());

        recorder.record(entry(1L, "op", Instant.now()));

        assertThat(recorder.isEnabled()).isFalse();
        assertThat(recorder.history("ticket", 1L, null)).isEmpty();
    }

    @Test
    @DisplayName("Table names are checked")
    void illegalTableName() {
        assertThatThrownBy(() -> new JdbcAuditLog(db.getJdbcTemplate(), db.getCodec(), "audit; DROP", null))
            .isInstanceOf(WorkflowSecurityException.class);
    }
}
