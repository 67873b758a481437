package id.go.kemenkeu.djpbn.sakti.wf.starter.annotation;

import java.lang.annotation.*;

/**
 * Run the annotated method while holding the distributed mutex for
 * {@link #key()}, a SpEL expression over the method arguments.
 *
 * <pre>
 * &#64;ResourceLock(key = "'report:' + #reportId")
 * public void regenerate(long reportId) { ... }
 * </pre>
 */
@Target({ ElementType.METHOD })
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ResourceLock {
    String key();

    /** Lease in ms; -1 uses {@code sakti.wf.lock.ttl-ms}. */
    long ttlMs() default -1;

    /** Wait in ms; -1 uses {@code sakti.wf.lock.blocking-timeout-ms}. */
    long blockingTimeoutMs() default -1;
}
