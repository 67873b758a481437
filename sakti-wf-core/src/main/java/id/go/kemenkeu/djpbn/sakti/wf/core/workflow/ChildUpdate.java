package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Change to one child row applied under its parent's lock.
 * {@code toState} may be null for a pure column update.
 */
public final class ChildUpdate<S extends Enum<S>> {

    private final long childId;
    private final S toState;
    private final Map<String, Object> columnUpdates;

    public ChildUpdate(long childId, S toState, Map<String, Object> columnUpdates) {
        this.childId = childId;
        this.toState = toState;
        this.columnUpdates = columnUpdates == null ? Collections.<String, Object>emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(columnUpdates));
    }

    public static <S extends Enum<S>> ChildUpdate<S> toState(long childId, S toState) {
        return new ChildUpdate<>(childId, toState, null);
    }

    public long getChildId() { return childId; }
    public S getToState() { return toState; }
    public Map<String, Object> getColumnUpdates() { return columnUpdates; }
}
