package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Closed classification of every failure the engine surfaces.
 * RetryExecutor decides on {@link #isRetryable()} only, never on message text.
 */
public enum ErrorKind {

    VALIDATION(Category.VALIDATION, false),
    INVALID_TRANSITION(Category.VALIDATION, false),
    RESOURCE_NOT_FOUND(Category.VALIDATION, false),
    SECURITY(Category.VALIDATION, false),

    LOCK_ACQUISITION(Category.CONTENTION, true),
    STALE_OBJECT(Category.CONTENTION, true),
    SERIALIZATION_CONFLICT(Category.CONTENTION, true),

    TRANSIENT_CONNECTION(Category.INFRASTRUCTURE, true),
    SERVICE_UNAVAILABLE(Category.INFRASTRUCTURE, false),

    INTERNAL(Category.PROGRAMMING, false);

    public enum Category {
        VALIDATION,     // Caller input or illegal state change
        CONTENTION,     // Another writer holds the resource or moved the version
        INFRASTRUCTURE, // Lock store / database unreachable or slow
        PROGRAMMING     // Invariant violations, unexpected errors
    }

    private final Category category;
    private final boolean retryable;

    ErrorKind(Category category, boolean retryable) {
        this.category = category;
        this.retryable = retryable;
    }

    public Category getCategory() {
        return category;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
