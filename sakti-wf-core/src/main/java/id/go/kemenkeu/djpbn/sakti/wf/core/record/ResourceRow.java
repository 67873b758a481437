package id.go.kemenkeu.djpbn.sakti.wf.core.record;

import org.springframework.util.LinkedCaseInsensitiveMap;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.Collections;
import java.util.Map;

/**
 * Immutable snapshot of one resource row. Column lookup is case-insensitive.
 */
public final class ResourceRow {

    private final ResourceDescriptor descriptor;
    private final Map<String, Object> columns;

    private ResourceRow(ResourceDescriptor descriptor, Map<String, Object> columns) {
        this.descriptor = descriptor;
        LinkedCaseInsensitiveMap<Object> copy = new LinkedCaseInsensitiveMap<>(columns.size());
        copy.putAll(columns);
        this.columns = Collections.unmodifiableMap(copy);
    }

    public static ResourceRow of(ResourceDescriptor descriptor, Map<String, Object> columns) {
        return new ResourceRow(descriptor, columns);
    }

    /**
     * Snapshot after a successful versioned write of {@code changes}.
     */
    ResourceRow advance(Map<String, Object> changes, Instant modifiedAt) {
        LinkedCaseInsensitiveMap<Object> next = new LinkedCaseInsensitiveMap<>(columns.size());
        next.putAll(columns);
        next.putAll(changes);
        next.put(descriptor.getVersionColumn(), getVersion() + 1);
        if (descriptor.getModifiedAtColumn() != null && modifiedAt != null) {
            next.put(descriptor.getModifiedAtColumn(), Timestamp.from(modifiedAt));
        }
        return new ResourceRow(descriptor, next);
    }

    public ResourceDescriptor getDescriptor() {
        return descriptor;
    }

    public long getId() {
        return getLong(descriptor.getIdColumn());
    }

    public String getStatus() {
        return getString(descriptor.getStatusColumn());
    }

    public long getVersion() {
        Long version = getLong(descriptor.getVersionColumn());
        return version != null ? version : 0L;
    }

    public Long getParentId() {
        return descriptor.hasParent() ? getLong(descriptor.getParentColumn()) : null;
    }

    public Instant getModifiedAt() {
        return descriptor.getModifiedAtColumn() == null ? null : getInstant(descriptor.getModifiedAtColumn());
    }

    public Object get(String column) {
        return columns.get(column);
    }

    public String getString(String column) {
        Object v = columns.get(column);
        return v != null ? v.toString() : null;
    }

    public Long getLong(String column) {
        Object v = columns.get(column);
        if (v == null) {
            return null;
        }
        if (v instanceof Number) {
            return ((Number) v).longValue();
        }
        return Long.valueOf(v.toString());
    }

    public Boolean getBoolean(String column) {
        Object v = columns.get(column);
        if (v == null) {
            return null;
        }
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        return Boolean.valueOf(v.toString());
    }

    public Instant getInstant(String column) {
        Object v = columns.get(column);
        if (v == null) {
            return null;
        }
        if (v instanceof Timestamp) {
            return ((Timestamp) v).toInstant();
        }
        if (v instanceof Instant) {
            return (Instant) v;
        }
        if (v instanceof OffsetDateTime) {
            return ((OffsetDateTime) v).toInstant();
        }
        if (v instanceof LocalDateTime) {
            return ((LocalDateTime) v).atZone(ZoneId.systemDefault()).toInstant();
        }
        throw new IllegalStateException("Column " + column + " is not a timestamp: " + v.getClass());
    }

    public Map<String, Object> asMap() {
        return columns;
    }

    @Override
    public String toString() {
        return String.format("%s{id=%s, status=%s, version=%d}",
            descriptor.getResourceType(), get(descriptor.getIdColumn()), getStatus(), getVersion());
    }
}
