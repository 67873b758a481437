package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * Single-process lock store. Used when no Redis is configured and in tests.
 * Expiry is evaluated lazily against a monotonic clock.
 */
public class InMemoryLockStore implements LockStore {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public InMemoryLockStore() {
        this(System::nanoTime);
    }

    public InMemoryLockStore(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    @Override
    public boolean setIfAbsent(String key, String token, long ttlMs) {
        long now = nanoClock.getAsLong();
        Entry fresh = new Entry(token, now + TimeUnit.MILLISECONDS.toNanos(ttlMs));
        Entry winner = entries.compute(key, (k, existing) ->
            existing == null || existing.isExpired(now) ? fresh : existing);
        return winner == fresh;
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        long now = nanoClock.getAsLong();
        boolean[] deleted = new boolean[1];
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.token.equals(token)) {
                deleted[0] = true;
                return null;
            }
            return existing;
        });
        return deleted[0];
    }

    @Override
    public boolean compareAndExpire(String key, String token, long ttlMs) {
        long now = nanoClock.getAsLong();
        boolean[] extended = new boolean[1];
        entries.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                return null;
            }
            if (existing.token.equals(token)) {
                extended[0] = true;
                return new Entry(token, now + TimeUnit.MILLISECONDS.toNanos(ttlMs));
            }
            return existing;
        });
        return extended[0];
    }

    @Override
    public String currentToken(String key) {
        Entry entry = entries.get(key);
        if (entry == null || entry.isExpired(nanoClock.getAsLong())) {
            return null;
        }
        return entry.token;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private static final class Entry {
        private final String token;
        private final long expiresAtNanos;

        private Entry(String token, long expiresAtNanos) {
            this.token = token;
            this.expiresAtNanos = expiresAtNanos;
        }

        private boolean isExpired(long now) {
            return now - expiresAtNanos >= 0;
        }
    }
}
