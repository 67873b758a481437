package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

/**
 * The closed set of retry policies. Lookups go through {@link RetryPolicies},
 * which holds an entry for every constant.
 */
public enum RetryPolicyName {
    /** Single-row transitions. */
    DEFAULT,
    /** Hot counters and structured-field appends: many short retries. */
    HIGH_CONTENTION,
    /** Parent/child and bulk transitions: few, widely spaced retries. */
    MULTI_ROW,
    /** Lock store or database connectivity problems. */
    INFRASTRUCTURE
}
