package id.go.kemenkeu.djpbn.sakti.wf.core.metrics;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics collector for the workflow engine.
 * Plain counters; the starter bridges them to Micrometer.
 */
public class WorkflowMetrics {

    private final AtomicLong appliedTransitions = new AtomicLong(0);
    private final AtomicLong rejectedTransitions = new AtomicLong(0);
    private final AtomicLong failedTransitions = new AtomicLong(0);
    private final AtomicLong fieldUpdates = new AtomicLong(0);

    private final AtomicLong lockAcquisitions = new AtomicLong(0);
    private final AtomicLong lockTimeouts = new AtomicLong(0);
    private final AtomicLong staleReleases = new AtomicLong(0);

    private final AtomicLong retries = new AtomicLong(0);
    private final AtomicLong retriesExhausted = new AtomicLong(0);
    private final Map<ErrorKind, AtomicLong> failuresByKind = new EnumMap<>(ErrorKind.class);

    private final AtomicLong auditWriteFailures = new AtomicLong(0);

    private final AtomicLong totalLockWaitMs = new AtomicLong(0);
    private final AtomicLong maxLockWaitMs = new AtomicLong(0);
    private final AtomicLong totalTxDurationMs = new AtomicLong(0);
    private final AtomicLong maxTxDurationMs = new AtomicLong(0);
    private final AtomicLong criticalSections = new AtomicLong(0);

    public WorkflowMetrics() {
        for (ErrorKind kind : ErrorKind.values()) {
            failuresByKind.put(kind, new AtomicLong(0));
        }
    }

    public void recordTransitionApplied() {
        appliedTransitions.incrementAndGet();
    }

    public void recordTransitionRejected() {
        rejectedTransitions.incrementAndGet();
    }

    public void recordTransitionFailed(ErrorKind kind) {
        failedTransitions.incrementAndGet();
        recordFailure(kind);
    }

    public void recordFieldUpdate() {
        fieldUpdates.incrementAndGet();
    }

    public void recordLockAcquired(long waitMs) {
        lockAcquisitions.incrementAndGet();
        totalLockWaitMs.addAndGet(waitMs);
        updateMax(maxLockWaitMs, waitMs);
    }

    public void recordLockTimeout() {
        lockTimeouts.incrementAndGet();
    }

    public void recordStaleRelease() {
        staleReleases.incrementAndGet();
    }

    public void recordRetry(ErrorKind kind) {
        retries.incrementAndGet();
        recordFailure(kind);
    }

    public void recordRetriesExhausted() {
        retriesExhausted.incrementAndGet();
    }

    public void recordAuditWriteFailure() {
        auditWriteFailures.incrementAndGet();
    }

    public void recordCriticalSection(long txDurationMs) {
        criticalSections.incrementAndGet();
        totalTxDurationMs.addAndGet(txDurationMs);
        updateMax(maxTxDurationMs, txDurationMs);
    }

    private void recordFailure(ErrorKind kind) {
        if (kind != null) {
            failuresByKind.get(kind).incrementAndGet();
        }
    }

    private static void updateMax(AtomicLong max, long value) {
        long current = max.get();
        while (value > current) {
            if (max.compareAndSet(current, value)) {
                break;
            }
            current = max.get();
        }
    }

    // Getters
    public long getAppliedTransitions() { return appliedTransitions.get(); }
    public long getRejectedTransitions() { return rejectedTransitions.get(); }
    public long getFailedTransitions() { return failedTransitions.get(); }
    public long getFieldUpdates() { return fieldUpdates.get(); }

    public long getLockAcquisitions() { return lockAcquisitions.get(); }
    public long getLockTimeouts() { return lockTimeouts.get(); }
    public long getStaleReleases() { return staleReleases.get(); }

    public long getRetries() { return retries.get(); }
    public long getRetriesExhausted() { return retriesExhausted.get(); }
    public long getAuditWriteFailures() { return auditWriteFailures.get(); }

    public long getFailureCount(ErrorKind kind) {
        return failuresByKind.get(kind).get();
    }

    public double getAverageLockWaitMs() {
        long total = lockAcquisitions.get();
        return total > 0 ? (double) totalLockWaitMs.get() / total : 0.0;
    }

    public long getMaxLockWaitMs() { return maxLockWaitMs.get(); }

    public double getAverageTxDurationMs() {
        long total = criticalSections.get();
        return total > 0 ? (double) totalTxDurationMs.get() / total : 0.0;
    }

    public long getMaxTxDurationMs() { return maxTxDurationMs.get(); }

    @Override
    public String toString() {
        return String.format(
            "WorkflowMetrics{applied=%d, rejected=%d, failed=%d, fieldUpdates=%d, " +
            "lockTimeouts=%d, retries=%d (exhausted=%d), avgLockWait=%.2fms, avgTx=%.2fms, auditFailures=%d}",
            appliedTransitions.get(),
            rejectedTransitions.get(),
            failedTransitions.get(),
            fieldUpdates.get(),
            lockTimeouts.get(),
            retries.get(),
            retriesExhausted.get(),
            getAverageLockWaitMs(),
            getAverageTxDurationMs(),
            auditWriteFailures.get()
        );
    }
}
