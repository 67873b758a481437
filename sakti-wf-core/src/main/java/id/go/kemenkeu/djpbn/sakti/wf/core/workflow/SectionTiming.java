package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

/**
 * Lock wait and transaction time of the last critical section run with this
 * instance. Filled in on failure too.
 */
public final class SectionTiming {

    private volatile long lockWaitMs;
    private volatile long txDurationMs;

    void update(long lockWaitMs, long txDurationMs) {
        this.lockWaitMs = lockWaitMs;
        this.txDurationMs = txDurationMs;
    }

    public long getLockWaitMs() {
        return lockWaitMs;
    }

    public long getTxDurationMs() {
        return txDurationMs;
    }
}
