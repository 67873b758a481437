package id.go.kemenkeu.djpbn.sakti.wf.core.record;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ResourceNotFoundException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.StaleObjectException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Optimistic concurrency on the per-row version counter.
 *
 * <p>Every write is {@code UPDATE ... SET <changed columns>, version = version + 1
 * WHERE id = ? AND version = ?}. Zero affected rows means another writer got
 * there first and is reported as {@link StaleObjectException}.</p>
 */
public class VersionedRecordRepository {

    private static final Logger log = LoggerFactory.getLogger(VersionedRecordRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public VersionedRecordRepository(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("JdbcTemplate cannot be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    public long currentVersion(ResourceDescriptor descriptor, long id) {
        String sql = "SELECT " + descriptor.getVersionColumn() + " FROM " + descriptor.getTable()
            + " WHERE " + descriptor.getIdColumn() + " = ?";
        List<Long> versions = jdbcTemplate.queryForList(sql, Long.class, id);
        if (versions.isEmpty()) {
            throw new ResourceNotFoundException(descriptor.getResourceType(), id);
        }
        return versions.get(0);
    }

    public boolean checkVersion(ResourceDescriptor descriptor, long id, long expected) {
        return currentVersion(descriptor, id) == expected;
    }

    /**
     * Write {@code changes} on top of {@code current}, conditional on the
     * version still being {@code current.getVersion()}.
     *
     * @return the row as it is after the write (version + 1)
     */
    public ResourceRow writeVersioned(ResourceRow current, Map<String, Object> changes, Instant modifiedAt) {
        update(current.getDescriptor(), current.getId(), current.getVersion(), changes, modifiedAt);
        return current.advance(changes, modifiedAt);
    }

    /**
     * Conditional write when the caller only tracked the id and version.
     *
     * @return the new version
     */
    public long writeVersioned(ResourceDescriptor descriptor, long id, long expectedVersion,
                               Map<String, Object> changes, Instant modifiedAt) {
        update(descriptor, id, expectedVersion, changes, modifiedAt);
        return expectedVersion + 1;
    }

    private void update(ResourceDescriptor d, long id, long expectedVersion,
                        Map<String, Object> changes, Instant modifiedAt) {
        for (String column : changes.keySet()) {
            if (!d.isWritable(column)) {
                throw new ValidationException("Column '" + column + "' is not writable on " + d.getResourceType());
            }
        }

        StringBuilder sql = new StringBuilder("UPDATE ").append(d.getTable()).append(" SET ");
        List<Object> args = new ArrayList<>(changes.size() + 3);
        for (Map.Entry<String, Object> e : changes.entrySet()) {
            sql.append(SqlIdentifiers.require(e.getKey(), "column")).append(" = ?, ");
            args.add(e.getValue());
        }
        sql.append(d.getVersionColumn()).append(" = ").append(d.getVersionColumn()).append(" + 1");
        if (d.getModifiedAtColumn() != null && modifiedAt != null) {
            sql.append(", ").append(d.getModifiedAtColumn()).append(" = ?");
            args.add(Timestamp.from(modifiedAt));
        }
        sql.append(" WHERE ").append(d.getIdColumn()).append(" = ? AND ")
            .append(d.getVersionColumn()).append(" = ?");
        args.add(id);
        args.add(expectedVersion);

        int updated = jdbcTemplate.update(sql.toString(), args.toArray());
        if (updated == 0) {
            log.warn("Stale write rejected: {} {} expected version {}", d.getResourceType(), id, expectedVersion);
            throw new StaleObjectException(d.getResourceType(), id, expectedVersion);
        }
        log.debug("{} {} written: version {} -> {} ({})", d.getResourceType(), id,
            expectedVersion, expectedVersion + 1, changes.keySet());
    }

    /**
     * Lock-free read-compute-write. The mutation sees an unlocked snapshot; if
     * anyone writes the row in between, the conditional update fails with
     * {@link StaleObjectException} and the caller (usually RetryExecutor)
     * starts over.
     */
    public ResourceRow updateOptimistically(ResourceDescriptor descriptor, long id,
                                            Function<ResourceRow, Map<String, Object>> mutation) {
        return updateOptimistically(descriptor, id, mutation, Instant.now());
    }

    public ResourceRow updateOptimistically(ResourceDescriptor descriptor, long id,
                                            Function<ResourceRow, Map<String, Object>> mutation,
                                            Instant modifiedAt) {
        String sql = "SELECT * FROM " + descriptor.getTable()
            + " WHERE " + descriptor.getIdColumn() + " = ?";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, id);
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException(descriptor.getResourceType(), id);
        }
        ResourceRow snapshot = ResourceRow.of(descriptor, rows.get(0));
        return writeVersioned(snapshot, mutation.apply(snapshot), modifiedAt);
    }
}
