package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.LockAcquisitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.TransientConnectionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Token-based mutex: set-if-absent with expiry to acquire, compare-and-delete
 * to release. Between attempts the caller sleeps a random interval in
 * {@code [pollMinMs, pollMaxMs]} so that waiters do not retry in lockstep.
 *
 * <p>Not reentrant: acquiring the same key twice from one thread blocks until
 * the first lease expires.</p>
 */
public class StoreBackedDistributedMutex implements DistributedMutex {

    private static final Logger log = LoggerFactory.getLogger(StoreBackedDistributedMutex.class);

    public static final long DEFAULT_POLL_MIN_MS = 10;
    public static final long DEFAULT_POLL_MAX_MS = 50;

    private final LockStore store;
    private final WorkflowMetrics metrics;
    private final long pollMinMs;
    private final long pollMaxMs;

    public StoreBackedDistributedMutex(LockStore store, WorkflowMetrics metrics) {
        this(store, metrics, DEFAULT_POLL_MIN_MS, DEFAULT_POLL_MAX_MS);
    }

    public StoreBackedDistributedMutex(LockStore store, WorkflowMetrics metrics,
                                       long pollMinMs, long pollMaxMs) {
        if (store == null) {
            throw new IllegalArgumentException("LockStore cannot be null");
        }
        if (pollMinMs <= 0 || pollMaxMs < pollMinMs) {
            throw new IllegalArgumentException(
                "Invalid poll interval [" + pollMinMs + ", " + pollMaxMs + "]");
        }
        this.store = store;
        this.metrics = metrics != null ? metrics : new WorkflowMetrics();
        this.pollMinMs = pollMinMs;
        this.pollMaxMs = pollMaxMs;
    }

    @Override
    public LockHandle acquire(String key, long ttlMs, long blockingTimeoutMs) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key cannot be empty");
        }
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }

        String token = UUID.randomUUID().toString();
        long start = System.nanoTime();
        long deadline = start + TimeUnit.MILLISECONDS.toNanos(Math.max(0, blockingTimeoutMs));
        int attempts = 0;

        while (true) {
            attempts++;
            if (trySet(key, token, ttlMs)) {
                long waitMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                Instant now = Instant.now();
                metrics.recordLockAcquired(waitMs);
                log.debug("Lock acquired: {} (waited {}ms, attempts {})", key, waitMs, attempts);
                return new LockHandle(this, key, token, now, now.plusMillis(ttlMs), waitMs);
            }

            long remainingNanos = deadline - System.nanoTime();
            if (remainingNanos <= 0) {
                metrics.recordLockTimeout();
                log.warn("Failed to acquire lock: {} within {}ms ({} attempts)",
                    key, blockingTimeoutMs, attempts);
                throw new LockAcquisitionException(
                    "Timed out after " + blockingTimeoutMs + "ms waiting for lock " + key);
            }

            long pauseMs = ThreadLocalRandom.current().nextLong(pollMinMs, pollMaxMs + 1);
            long pauseNanos = Math.min(TimeUnit.MILLISECONDS.toNanos(pauseMs), remainingNanos);
            try {
                TimeUnit.NANOSECONDS.sleep(pauseNanos);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException("Interrupted while waiting for lock " + key, e);
            }
        }
    }

    @Override
    public boolean release(LockHandle handle) {
        if (handle == null || !handle.markReleased()) {
            return false;
        }
        try {
            boolean released = store.compareAndDelete(handle.getKey(), handle.getToken());
            if (released) {
                log.debug("Lock released: {}", handle.getKey());
            } else {
                metrics.recordStaleRelease();
                log.warn("Lock {} no longer owned by this holder (expired at {}); release skipped",
                    handle.getKey(), handle.getExpiresAt());
            }
            return released;
        } catch (RuntimeException e) {
            // The lease still bounds how long the key can stay held.
            log.error("Failed to release lock: {} - will expire at {}",
                handle.getKey(), handle.getExpiresAt(), e);
            return false;
        }
    }

    @Override
    public boolean extend(LockHandle handle, long ttlMs) {
        if (handle == null || handle.isReleased()) {
            return false;
        }
        try {
            boolean extended = store.compareAndExpire(handle.getKey(), handle.getToken(), ttlMs);
            if (extended) {
                handle.extendedUntil(Instant.now().plusMillis(ttlMs));
                log.debug("Lock extended: {} by {}ms", handle.getKey(), ttlMs);
            } else {
                log.warn("Cannot extend lock {}: no longer owned by this holder", handle.getKey());
            }
            return extended;
        } catch (RuntimeException e) {
            throw new TransientConnectionException("Lock store unavailable while extending " + handle.getKey(), e);
        }
    }

    private boolean trySet(String key, String token, long ttlMs) {
        try {
            return store.setIfAbsent(key, token, ttlMs);
        } catch (RuntimeException e) {
            throw new TransientConnectionException("Lock store unavailable while acquiring " + key, e);
        }
    }
}
