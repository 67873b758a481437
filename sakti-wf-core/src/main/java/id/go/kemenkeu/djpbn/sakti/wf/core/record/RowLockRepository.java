package id.go.kemenkeu.djpbn.sakti.wf.core.record;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Database-native exclusive row locks ({@code SELECT ... FOR UPDATE}).
 *
 * <p>Locks last until the surrounding transaction commits or rolls back, so
 * every method here refuses to run outside one. They also protect against
 * writers that never touch the distributed mutex.</p>
 */
public class RowLockRepository {

    private static final Logger log = LoggerFactory.getLogger(RowLockRepository.class);

    private final JdbcTemplate jdbcTemplate;

    public RowLockRepository(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("JdbcTemplate cannot be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    public ResourceRow lockForUpdate(ResourceDescriptor descriptor, long id) {
        requireTransaction(descriptor);
        String sql = "SELECT * FROM " + descriptor.getTable()
            + " WHERE " + descriptor.getIdColumn() + " = ? FOR UPDATE";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, id);
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException(descriptor.getResourceType(), id);
        }
        log.debug("Row lock taken: {} {}", descriptor.getResourceType(), id);
        return ResourceRow.of(descriptor, rows.get(0));
    }

    /**
     * Lock several rows, always in ascending id order so that two callers
     * locking overlapping sets cannot deadlock each other.
     */
    public List<ResourceRow> lockAllForUpdate(ResourceDescriptor descriptor, Collection<Long> ids) {
        requireTransaction(descriptor);
        List<ResourceRow> locked = new ArrayList<>(ids.size());
        for (Long id : new TreeSet<>(ids)) {
            locked.add(lockForUpdate(descriptor, id));
        }
        return locked;
    }

    public List<ResourceRow> lockChildrenForUpdate(ResourceDescriptor descriptor, long parentId) {
        requireTransaction(descriptor);
        if (!descriptor.hasParent()) {
            throw new IllegalArgumentException(descriptor.getResourceType() + " has no parent column");
        }
        String sql = "SELECT * FROM " + descriptor.getTable()
            + " WHERE " + descriptor.getParentColumn() + " = ?"
            + " ORDER BY " + descriptor.getIdColumn() + " FOR UPDATE";
        List<ResourceRow> children = new ArrayList<>();
        for (Map<String, Object> row : jdbcTemplate.queryForList(sql, parentId)) {
            children.add(ResourceRow.of(descriptor, row));
        }
        log.debug("Row locks taken on {} children of {}", children.size(), parentId);
        return children;
    }

    /**
     * Plain read without a lock. The result may be stale by the time it is used.
     */
    public ResourceRow read(ResourceDescriptor descriptor, long id) {
        String sql = "SELECT * FROM " + descriptor.getTable()
            + " WHERE " + descriptor.getIdColumn() + " = ?";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, id);
        if (rows.isEmpty()) {
            throw new ResourceNotFoundException(descriptor.getResourceType(), id);
        }
        return ResourceRow.of(descriptor, rows.get(0));
    }

    private static void requireTransaction(ResourceDescriptor descriptor) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException(
                "Row lock on " + descriptor.getResourceType() + " requested outside a transaction");
        }
    }
}
