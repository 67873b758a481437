package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

/**
 * Shared key-value store the distributed mutex is built on.
 *
 * <p>Implementations must make every method atomic with respect to other
 * processes using the same store, and must be safe for concurrent use.</p>
 */
public interface LockStore {

    /**
     * SET key token NX PX ttl.
     *
     * @return true if the key was absent (or expired) and is now owned by {@code token}
     */
    boolean setIfAbsent(String key, String token, long ttlMs);

    /**
     * Delete the key only if it still holds {@code token}.
     */
    boolean compareAndDelete(String key, String token);

    /**
     * Reset the key's expiry only if it still holds {@code token}.
     */
    boolean compareAndExpire(String key, String token, long ttlMs);

    /**
     * Token currently stored under the key, or null if absent/expired.
     */
    String currentToken(String key);

    boolean ping();
}
