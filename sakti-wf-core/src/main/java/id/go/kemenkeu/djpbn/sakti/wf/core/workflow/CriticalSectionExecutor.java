package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.context.CorrelationContext;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorClassifier;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.LockAcquisitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowException;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.DistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockHandle;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;

/**
 * Mutex, then one transaction, then release.
 *
 * <p>The mutex is taken before the transaction opens and released only after
 * it has committed or rolled back. The section always runs in its own
 * transaction: a caller's transaction is suspended, never joined, so the
 * commit happens before the mutex is released.</p>
 *
 * <p>The transaction timeout is the database lock-wait budget, which never
 * exceeds the mutex TTL. Spring hands the remaining time to every JDBC
 * statement as its query timeout, so a blocked {@code SELECT ... FOR UPDATE}
 * gives up before the lock guarding it can expire.</p>
 */
public class CriticalSectionExecutor {

    private static final Logger log = LoggerFactory.getLogger(CriticalSectionExecutor.class);

    private final DistributedMutex mutex;
    private final PlatformTransactionManager transactionManager;
    private final WorkflowMetrics metrics;
    private final long ttlMs;
    private final long blockingTimeoutMs;
    private final long databaseLockTimeoutMs;

    public CriticalSectionExecutor(DistributedMutex mutex, PlatformTransactionManager transactionManager,
                                   WorkflowMetrics metrics, long ttlMs, long blockingTimeoutMs) {
        this(mutex, transactionManager, metrics, ttlMs, blockingTimeoutMs, ttlMs);
    }

    /**
     * @param databaseLockTimeoutMs upper bound for the section's transaction,
     *                              row-lock waits included; at most {@code ttlMs}
     */
    public CriticalSectionExecutor(DistributedMutex mutex, PlatformTransactionManager transactionManager,
                                   WorkflowMetrics metrics, long ttlMs, long blockingTimeoutMs,
                                   long databaseLockTimeoutMs) {
        if (mutex == null || transactionManager == null) {
            throw new IllegalArgumentException("DistributedMutex and PlatformTransactionManager are required");
        }
        if (ttlMs < 1000) {
            throw new IllegalArgumentException("Lock TTL must be at least 1000ms, got " + ttlMs);
        }
        if (blockingTimeoutMs < 0) {
            throw new IllegalArgumentException("Blocking timeout cannot be negative");
        }
        if (databaseLockTimeoutMs <= 0 || databaseLockTimeoutMs > ttlMs) {
            throw new IllegalArgumentException("Database lock timeout must be in (0, " + ttlMs
                + "]ms, got " + databaseLockTimeoutMs);
        }
        this.mutex = mutex;
        this.transactionManager = transactionManager;
        this.metrics = metrics != null ? metrics : new WorkflowMetrics();
        this.ttlMs = ttlMs;
        this.blockingTimeoutMs = blockingTimeoutMs;
        this.databaseLockTimeoutMs = databaseLockTimeoutMs;
    }

    /**
     * Run {@code body} holding {@code lockKey} inside a new transaction.
     * Every failure leaves as a {@link WorkflowException}.
     *
     * @param deadline optional; shortens the mutex wait to the time remaining
     * @param timing   receives lock wait and transaction duration, may be null
     */
    public <T> T execute(String lockKey, Instant deadline, SectionTiming timing, TransactionCallback<T> body) {
        long waitBudget = blockingTimeoutMs;
        if (deadline != null) {
            long remaining = Duration.between(Instant.now(), deadline).toMillis();
            if (remaining <= 0) {
                throw new LockAcquisitionException("Deadline passed before acquiring " + lockKey);
            }
            waitBudget = Math.min(waitBudget, remaining);
        }

        LockHandle handle = mutex.acquire(lockKey, ttlMs, waitBudget);
        long start = System.nanoTime();
        try {
            TransactionTemplate tx = new TransactionTemplate(transactionManager);
            tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
            tx.setTimeout(transactionTimeoutSeconds());
            return tx.execute(body);
        } catch (WorkflowException e) {
            throw e;
        } catch (RuntimeException e) {
            WorkflowException translated = ErrorClassifier.translate(e, "Critical section " + lockKey);
            if (translated.getKind() == ErrorKind.INTERNAL) {
                log.error("Unexpected failure in critical section {} correlationId={}",
                    lockKey, CorrelationContext.current(), e);
            } else {
                log.warn("Critical section {} rolled back: {} ({})", lockKey, translated.getKind(), e.getMessage());
            }
            throw translated;
        } finally {
            long txMs = (System.nanoTime() - start) / 1_000_000L;
            metrics.recordCriticalSection(txMs);
            if (timing != null) {
                timing.update(handle.getWaitMs(), txMs);
            }
            mutex.release(handle);
        }
    }

    /**
     * Whole seconds, rounded down, so the bound stays within the lock-wait
     * budget and therefore within the TTL.
     */
    public int transactionTimeoutSeconds() {
        return (int) Math.max(1L, databaseLockTimeoutMs / 1000L);
    }

    public long getTtlMs() {
        return ttlMs;
    }

    public long getBlockingTimeoutMs() {
        return blockingTimeoutMs;
    }

    public long getDatabaseLockTimeoutMs() {
        return databaseLockTimeoutMs;
    }
}
