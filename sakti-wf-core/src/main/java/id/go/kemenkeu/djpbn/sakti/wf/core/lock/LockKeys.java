package id.go.kemenkeu.djpbn.sakti.wf.core.lock;

/**
 * Deterministic lock key derivation: the same resource always maps to the same
 * key, different resources never share one.
 */
public final class LockKeys {

    public static final String DEFAULT_PREFIX = "workflow:";

    private LockKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String forResource(String prefix, String resourceType, Object resourceId) {
        if (resourceType == null || resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType cannot be empty");
        }
        if (resourceId == null) {
            throw new IllegalArgumentException("resourceId cannot be null");
        }
        String p = (prefix == null || prefix.isEmpty()) ? DEFAULT_PREFIX : prefix;
        return p + resourceType + ":" + resourceId;
    }

    public static String forResource(String resourceType, Object resourceId) {
        return forResource(DEFAULT_PREFIX, resourceType, resourceId);
    }
}
