package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive jitter.
 *
 * <pre>
 * delay = min(baseDelay * 2^retry + random(0, baseDelay), maxDelay)
 * </pre>
 *
 * <p>{@code retry} starts at 0 for the pause before the second attempt.</p>
 */
public final class BackoffCalculator {

    private BackoffCalculator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static long delayMs(RetryPolicy policy, int retry) {
        if (retry < 0) {
            throw new IllegalArgumentException("retry must be >= 0 (current: " + retry + ")");
        }
        long base = policy.getBaseDelayMs();
        long max = policy.getMaxDelayMs();

        // Cap the shift so the multiplication cannot overflow
        int shift = Math.min(retry, 30);
        long exponential = Math.min(base * (1L << shift), max);
        long jitter = ThreadLocalRandom.current().nextLong(0, base + 1);
        return Math.min(exponential + jitter, max);
    }
}
