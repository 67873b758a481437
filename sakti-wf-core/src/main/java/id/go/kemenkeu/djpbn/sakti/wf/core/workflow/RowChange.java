package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One committed row write: the locked snapshot, the columns written and the
 * row as it is afterwards.
 */
public final class RowChange {

    private final String operation;
    private final ResourceRow before;
    private final ResourceRow after;
    private final Map<String, Object> changes;

    RowChange(String operation, ResourceRow before, ResourceRow after, Map<String, Object> changes) {
        this.operation = operation;
        this.before = before;
        this.after = after;
        this.changes = Collections.unmodifiableMap(new LinkedHashMap<>(changes));
    }

    public String getOperation() { return operation; }
    public ResourceRow getBefore() { return before; }
    public ResourceRow getAfter() { return after; }
    public Map<String, Object> getChanges() { return changes; }
}
