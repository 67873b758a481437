package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowSecurityException;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.StructuredFieldCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link AuditLog} on a relational table.
 *
 * <pre>
 * CREATE TABLE workflow_audit_log (
 *     seq            BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
 *     resource_type  VARCHAR(64)  NOT NULL,
 *     resource_id    BIGINT       NOT NULL,
 *     operation      VARCHAR(64)  NOT NULL,
 *     outcome        VARCHAR(16)  NOT NULL,
 *     old_value      TEXT,
 *     new_value      TEXT,
 *     actor          VARCHAR(128),
 *     lock_wait_ms   BIGINT,
 *     tx_duration_ms BIGINT,
 *     correlation_id VARCHAR(64),
 *     error_kind     VARCHAR(32),
 *     created_at     TIMESTAMP    NOT NULL
 * );
 * </pre>
 *
 * Pages are fetched by keyset on {@code seq}, so a reader never sees the
 * same entry twice even while writers keep appending.
 */
public class JdbcAuditLog implements AuditLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditLog.class);

    private static final Pattern TABLE_NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_.]{0,62}$");

    private final JdbcTemplate jdbcTemplate;
    private final StructuredFieldCodec codec;
    private final String table;
    private final TransactionTemplate ownTransaction;

    public JdbcAuditLog(JdbcTemplate jdbcTemplate, StructuredFieldCodec codec) {
        this(jdbcTemplate, codec, "workflow_audit_log", null);
    }

    /**
     * @param transactionManager when given, every append runs in its own
     *                           REQUIRES_NEW transaction
     */
    public JdbcAuditLog(JdbcTemplate jdbcTemplate, StructuredFieldCodec codec, String table,
                        PlatformTransactionManager transactionManager) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("JdbcTemplate cannot be null");
        }
        if (table == null || !TABLE_NAME.matcher(table).matches()) {
            throw new WorkflowSecurityException("Illegal audit table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec != null ? codec : new StructuredFieldCodec();
        this.table = table;
        if (transactionManager != null) {
            this.ownTransaction = new TransactionTemplate(transactionManager);
            this.ownTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        } else {
            this.ownTransaction = null;
        }
    }

    @Override
    public void append(AuditEntry entry) {
        String sql = "INSERT INTO " + table + " (resource_type, resource_id, operation, outcome, "
            + "old_value, new_value, actor, lock_wait_ms, tx_duration_ms, correlation_id, "
            + "error_kind, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        Object[] args = {
            entry.getResourceType(),
            entry.getResourceId(),
            entry.getOperation(),
            entry.getOutcome().name(),
            entry.getOldValue() != null ? codec.write(entry.getOldValue()) : null,
            entry.getNewValue() != null ? codec.write(entry.getNewValue()) : null,
            entry.getActor(),
            entry.getLockWaitMs(),
            entry.getTxDurationMs(),
            entry.getCorrelationId(),
            entry.getErrorKind() != null ? entry.getErrorKind().name() : null,
            Timestamp.from(entry.getTimestamp())
        };
        if (ownTransaction != null) {
            ownTransaction.executeWithoutResult(status -> jdbcTemplate.update(sql, args));
        } else {
            jdbcTemplate.update(sql, args);
        }
        log.debug("Audit appended: {}", entry);
    }

    @Override
    public Stream<AuditEntry> query(String resourceType, long resourceId, Instant since, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        return StreamSupport.stream(new PageSpliterator(resourceType, resourceId, since, pageSize), false);
    }

    private List<AuditEntry> fetchPage(String resourceType, long resourceId, Instant since,
                                       long afterSeq, int pageSize) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table)
            .append(" WHERE resource_type = ? AND resource_id = ? AND seq > ?");
        List<Object> args = new ArrayList<>(5);
        args.add(resourceType);
        args.add(resourceId);
        args.add(afterSeq);
        if (since != null) {
            sql.append(" AND created_at >= ?");
            args.add(Timestamp.from(since));
        }
        sql.append(" ORDER BY seq LIMIT ?");
        args.add(pageSize);
        return jdbcTemplate.query(sql.toString(), rowMapper(), args.toArray());
    }

    private RowMapper<AuditEntry> rowMapper() {
        return (rs, rowNum) -> {
            String errorKind = rs.getString("error_kind");
            String oldValue = rs.getString("old_value");
            String newValue = rs.getString("new_value");
            return AuditEntry.builder()
                .sequence(rs.getLong("seq"))
                .resourceType(rs.getString("resource_type"))
                .resourceId(rs.getLong("resource_id"))
                .operation(rs.getString("operation"))
                .outcome(AuditOutcome.valueOf(rs.getString("outcome")))
                .oldValue(oldValue != null ? codec.readMap(oldValue) : null)
                .newValue(newValue != null ? codec.readMap(newValue) : null)
                .actor(rs.getString("actor"))
                .lockWaitMs(rs.getLong("lock_wait_ms"))
                .txDurationMs(rs.getLong("tx_duration_ms"))
                .correlationId(rs.getString("correlation_id"))
                .errorKind(errorKind != null ? ErrorKind.valueOf(errorKind) : null)
                .timestamp(rs.getTimestamp("created_at").toInstant())
                .build();
        };
    }

    private final class PageSpliterator extends Spliterators.AbstractSpliterator<AuditEntry> {

        private final String resourceType;
        private final long resourceId;
        private final Instant since;
        private final int pageSize;
        private final Deque<AuditEntry> buffer = new ArrayDeque<>();
        private long lastSeq = 0L;
        private boolean exhausted;

        private PageSpliterator(String resourceType, long resourceId, Instant since, int pageSize) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.resourceType = resourceType;
            this.resourceId = resourceId;
            this.since = since;
            this.pageSize = pageSize;
        }

        @Override
        public boolean tryAdvance(Consumer<? super AuditEntry> action) {
            if (buffer.isEmpty() && !exhausted) {
                List<AuditEntry> page = fetchPage(resourceType, resourceId, since, lastSeq, pageSize);
                if (page.size() < pageSize) {
                    exhausted = true;
                }
                if (!page.isEmpty()) {
                    lastSeq = page.get(page.size() - 1).getSequence();
                    buffer.addAll(page);
                }
            }
            AuditEntry next = buffer.poll();
            if (next == null) {
                return false;
            }
            action.accept(next);
            return true;
        }
    }

    public String getTable() {
        return table;
    }
}
