package id.go.kemenkeu.djpbn.sakti.wf.core.record;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Describes where a resource type lives in the relational store.
 * The engine only reads and writes the columns named here.
 */
public final class ResourceDescriptor {

    private final String resourceType;
    private final String table;
    private final String idColumn;
    private final String statusColumn;
    private final String versionColumn;
    private final String modifiedAtColumn;
    private final String parentColumn;
    private final Set<String> structuredColumns;
    private final Set<String> writableColumns;

    private ResourceDescriptor(Builder b) {
        if (b.resourceType == null || b.resourceType.isBlank()) {
            throw new IllegalArgumentException("resourceType is required");
        }
        this.resourceType = b.resourceType;
        this.table = SqlIdentifiers.require(b.table, "table");
        this.idColumn = SqlIdentifiers.require(b.idColumn, "id column");
        this.statusColumn = SqlIdentifiers.require(b.statusColumn, "status column");
        this.versionColumn = SqlIdentifiers.require(b.versionColumn, "version column");
        this.modifiedAtColumn = b.modifiedAtColumn == null ? null
            : SqlIdentifiers.require(b.modifiedAtColumn, "modified-at column");
        this.parentColumn = b.parentColumn == null ? null
            : SqlIdentifiers.require(b.parentColumn, "parent column");
        this.structuredColumns = normalize(b.structuredColumns, "structured column");
        this.writableColumns = normalize(b.writableColumns, "writable column");
    }

    private static Set<String> normalize(Set<String> columns, String what) {
        Set<String> out = new LinkedHashSet<>();
        for (String c : columns) {
            out.add(SqlIdentifiers.require(c, what).toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(out);
    }

    public static Builder builder(String resourceType, String table) {
        return new Builder(resourceType, table);
    }

    public boolean isStructured(String column) {
        return column != null && structuredColumns.contains(column.toLowerCase(Locale.ROOT));
    }

    /**
     * Whether {@code column} may appear in a write issued by the engine.
     */
    public boolean isWritable(String column) {
        if (column == null) {
            return false;
        }
        String c = column.toLowerCase(Locale.ROOT);
        return writableColumns.contains(c)
            || structuredColumns.contains(c)
            || c.equalsIgnoreCase(statusColumn);
    }

    public boolean hasParent() {
        return parentColumn != null;
    }

    public String getResourceType() { return resourceType; }
    public String getTable() { return table; }
    public String getIdColumn() { return idColumn; }
    public String getStatusColumn() { return statusColumn; }
    public String getVersionColumn() { return versionColumn; }
    public String getModifiedAtColumn() { return modifiedAtColumn; }
    public String getParentColumn() { return parentColumn; }
    public Set<String> getStructuredColumns() { return structuredColumns; }
    public Set<String> getWritableColumns() { return writableColumns; }

    @Override
    public String toString() {
        return "ResourceDescriptor{" + resourceType + " -> " + table + "}";
    }

    public static final class Builder {
        private final String resourceType;
        private final String table;
        private String idColumn = "id";
        private String statusColumn = "status";
        private String versionColumn = "version";
        private String modifiedAtColumn = "modified_at";
        private String parentColumn;
        private final Set<String> structuredColumns = new LinkedHashSet<>();
        private final Set<String> writableColumns = new LinkedHashSet<>();

        private Builder(String resourceType, String table) {
            this.resourceType = resourceType;
            this.table = table;
        }

        public Builder idColumn(String idColumn) { this.idColumn = idColumn; return this; }
        public Builder statusColumn(String statusColumn) { this.statusColumn = statusColumn; return this; }
        public Builder versionColumn(String versionColumn) { this.versionColumn = versionColumn; return this; }
        public Builder modifiedAtColumn(String modifiedAtColumn) { this.modifiedAtColumn = modifiedAtColumn; return this; }
        public Builder parentColumn(String parentColumn) { this.parentColumn = parentColumn; return this; }

        public Builder structuredColumn(String column) {
            this.structuredColumns.add(column);
            return this;
        }

        public Builder writableColumn(String... columns) {
            Collections.addAll(this.writableColumns, columns);
            return this;
        }

        public ResourceDescriptor build() {
            return new ResourceDescriptor(this);
        }
    }
}
