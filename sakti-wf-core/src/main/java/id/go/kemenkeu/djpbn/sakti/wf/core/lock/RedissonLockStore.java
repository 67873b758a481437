package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

import org.redisson.api.RBucket;
import org.redisson.api.RScript;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * Redis/Dragonfly backed lock store.
 *
 * <p>Uses plain string buckets instead of {@code RLock} so the owner is an
 * explicit token rather than a thread id: a holder whose lease expired can
 * never delete a lock that was re-acquired by another process.</p>
 */
public class RedissonLockStore implements LockStore {

    private static final Logger log = LoggerFactory.getLogger(RedissonLockStore.class);

    private static final String COMPARE_AND_DELETE =
        "if redis.call('get', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('del', KEYS[1]) " +
        "else " +
        "  return 0 " +
        "end";

    private static final String COMPARE_AND_EXPIRE =
        "if redis.call('get', KEYS[1]) == ARGV[1] then " +
        "  return redis.call('pexpire', KEYS[1], ARGV[2]) " +
        "else " +
        "  return 0 " +
        "end";

    private final RedissonClient redissonClient;

    public RedissonLockStore(RedissonClient redissonClient) {
        if (redissonClient == null) {
            throw new IllegalArgumentException("RedissonClient cannot be null");
        }
        this.redissonClient = redissonClient;
    }

    @Override
    public boolean setIfAbsent(String key, String token, long ttlMs) {
        RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
        return bucket.setIfAbsent(token, Duration.ofMillis(ttlMs));
    }

    @Override
    public boolean compareAndDelete(String key, String token) {
        Long result = script().eval(RScript.Mode.READ_WRITE, COMPARE_AND_DELETE,
            RScript.ReturnType.INTEGER, keys(key), token);
        return result != null && result > 0;
    }

    @Override
    public boolean compareAndExpire(String key, String token, long ttlMs) {
        Long result = script().eval(RScript.Mode.READ_WRITE, COMPARE_AND_EXPIRE,
            RScript.ReturnType.INTEGER, keys(key), token, String.valueOf(ttlMs));
        return result != null && result > 0;
    }

    @Override
    public String currentToken(String key) {
        RBucket<String> bucket = redissonClient.getBucket(key, StringCodec.INSTANCE);
        return bucket.get();
    }

    @Override
    public boolean ping() {
        try {
            return redissonClient.getNodesGroup().pingAll();
        } catch (Exception e) {
            log.warn("Lock store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private RScript script() {
        return redissonClient.getScript(StringCodec.INSTANCE);
    }

    private static List<Object> keys(String key) {
        return Collections.singletonList(key);
    }
}
