package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Immutable retry parameters. {@code maxAttempts} counts the first attempt,
 * so 3 means one call plus two retries.
 */
public final class RetryPolicy {

    private final RetryPolicyName name;
    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Set<ErrorKind> retryableKinds;

    public RetryPolicy(RetryPolicyName name, int maxAttempts, long baseDelayMs, long maxDelayMs,
                       Set<ErrorKind> retryableKinds) {
        if (name == null) {
            throw new IllegalArgumentException("Policy name cannot be null");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1 (current: " + maxAttempts + ")");
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")");
        }
        for (ErrorKind kind : retryableKinds) {
            if (!kind.isRetryable()) {
                throw new IllegalArgumentException(kind + " can never be retried");
            }
        }
        this.name = name;
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.retryableKinds = retryableKinds.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(retryableKinds));
    }

    public static Set<ErrorKind> contentionAndTransient() {
        return EnumSet.of(ErrorKind.LOCK_ACQUISITION, ErrorKind.STALE_OBJECT,
            ErrorKind.SERIALIZATION_CONFLICT, ErrorKind.TRANSIENT_CONNECTION);
    }

    public static RetryPolicy defaults(RetryPolicyName name) {
        switch (name) {
            case HIGH_CONTENTION:
                return new RetryPolicy(name, 8, 25, 500, contentionAndTransient());
            case MULTI_ROW:
                return new RetryPolicy(name, 3, 250, 5000, contentionAndTransient());
            case INFRASTRUCTURE:
                return new RetryPolicy(name, 5, 500, 10000,
                    EnumSet.of(ErrorKind.TRANSIENT_CONNECTION, ErrorKind.LOCK_ACQUISITION));
            case DEFAULT:
            default:
                return new RetryPolicy(name, 3, 100, 2000, contentionAndTransient());
        }
    }

    public boolean isRetryable(ErrorKind kind) {
        return kind != null && retryableKinds.contains(kind);
    }

    public RetryPolicyName getName() { return name; }
    public int getMaxAttempts() { return maxAttempts; }
    public long getBaseDelayMs() { return baseDelayMs; }
    public long getMaxDelayMs() { return maxDelayMs; }
    public Set<ErrorKind> getRetryableKinds() { return retryableKinds; }

    @Override
    public String toString() {
        return String.format("RetryPolicy{%s, attempts=%d, base=%dms, max=%dms, retryable=%s}",
            name, maxAttempts, baseDelayMs, maxDelayMs, retryableKinds);
    }
}
