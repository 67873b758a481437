package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A held distributed mutex. Only the holder of {@link #getToken()} can release
 * or extend it. Closing the handle releases it.
 */
public final class LockHandle implements AutoCloseable {

    private final DistributedMutex mutex;
    private final String key;
    private final String token;
    private final Instant acquiredAt;
    private final long waitMs;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private volatile Instant expiresAt;

    LockHandle(DistributedMutex mutex, String key, String token,
               Instant acquiredAt, Instant expiresAt, long waitMs) {
        this.mutex = mutex;
        this.key = key;
        this.token = token;
        this.acquiredAt = acquiredAt;
        this.expiresAt = expiresAt;
        this.waitMs = waitMs;
    }

    public String getKey() { return key; }
    public String getToken() { return token; }
    public Instant getAcquiredAt() { return acquiredAt; }
    public Instant getExpiresAt() { return expiresAt; }

    /**
     * Time spent waiting for the lock, in milliseconds.
     */
    public long getWaitMs() { return waitMs; }

    public boolean isReleased() { return released.get(); }

    void extendedUntil(Instant newExpiry) {
        this.expiresAt = newExpiry;
    }

    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    @Override
    public void close() {
        if (!released.get()) {
            mutex.release(this);
        }
    }

    @Override
    public String toString() {
        return "LockHandle{key=" + key + ", acquiredAt=" + acquiredAt + ", expiresAt=" + expiresAt + "}";
    }
}
