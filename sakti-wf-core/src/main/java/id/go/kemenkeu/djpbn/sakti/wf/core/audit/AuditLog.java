package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import java.time.Instant;
import java.util.stream.Stream;

/**
 * Append-only audit trail.
 */
public interface AuditLog {

    int DEFAULT_PAGE_SIZE = 100;

    /**
     * Durably append one entry. Implementations must not join the caller's
     * business transaction.
     */
    void append(AuditEntry entry);

    /**
     * Entries for one resource, oldest first. The stream is lazy and fetches
     * page by page; close it when abandoning it early.
     *
     * @param since inclusive lower bound on the entry timestamp, or null for all
     */
    Stream<AuditEntry> query(String resourceType, long resourceId, Instant since, int pageSize);

    default Stream<AuditEntry> query(String resourceType, long resourceId, Instant since) {
        return query(resourceType, resourceId, since, DEFAULT_PAGE_SIZE);
    }
}
