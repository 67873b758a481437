package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Raised when a conditional write finds the version moved underneath it.
 */
public class StaleObjectException extends WorkflowException {

    private final Object resourceId;
    private final long expectedVersion;

    public StaleObjectException(String resourceType, Object resourceId, long expectedVersion) {
        super(ErrorKind.STALE_OBJECT,
            String.format("%s %s was modified concurrently (expected version %d)",
                resourceType, resourceId, expectedVersion),
            "Data telah diubah oleh pengguna lain. Silakan coba lagi.");
        this.resourceId = resourceId;
        this.expectedVersion = expectedVersion;
    }

    public Object getResourceId() {
        return resourceId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
