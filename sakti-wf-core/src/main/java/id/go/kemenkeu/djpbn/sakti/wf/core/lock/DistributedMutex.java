package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.LockAcquisitionException;

/**
 * Named, TTL-bounded lock shared by every process that talks to the same store.
 */
public interface DistributedMutex {

    /**
     * Acquire {@code key}, waiting at most {@code blockingTimeoutMs}.
     *
     * @param ttlMs lease; the lock self-expires after this if the holder dies
     * @throws LockAcquisitionException if the wait elapses
     */
    LockHandle acquire(String key, long ttlMs, long blockingTimeoutMs);

    /**
     * Release the lock if the handle's token still owns it.
     *
     * @return false if the lock had already expired or belongs to another holder
     */
    boolean release(LockHandle handle);

    /**
     * Push the expiry out to {@code ttlMs} from now, if still owned.
     */
    boolean extend(LockHandle handle, long ttlMs);
}
