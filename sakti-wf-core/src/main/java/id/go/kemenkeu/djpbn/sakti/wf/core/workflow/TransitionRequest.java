package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One requested status change, consumed once by a workflow service.
 */
public final class TransitionRequest<S extends Enum<S>> {

    private final long resourceId;
    private final S expectedFrom;
    private final S toState;
    private final String actor;
    private final String correlationId;
    private final boolean validate;
    private final Map<String, Object> columnUpdates;
    private final Map<String, Map<String, Object>> fieldMerges;
    private final Instant deadline;

    private TransitionRequest(Builder<S> b) {
        if (b.toState == null) {
            throw new IllegalArgumentException("Target state is required");
        }
        this.resourceId = b.resourceId;
        this.expectedFrom = b.expectedFrom;
        this.toState = b.toState;
        this.actor = b.actor != null ? b.actor : "system";
        this.correlationId = b.correlationId;
        this.validate = b.validate;
        this.columnUpdates = Collections.unmodifiableMap(new LinkedHashMap<>(b.columnUpdates));
        this.fieldMerges = Collections.unmodifiableMap(new LinkedHashMap<>(b.fieldMerges));
        this.deadline = b.deadline;
    }

    public static <S extends Enum<S>> Builder<S> builder(long resourceId, S toState) {
        return new Builder<>(resourceId, toState);
    }

    public long getResourceId() { return resourceId; }
    /** State the caller believes the resource is in, or null to skip the check. */
    public S getExpectedFrom() { return expectedFrom; }
    public S getToState() { return toState; }
    public String getActor() { return actor; }
    public String getCorrelationId() { return correlationId; }
    public boolean isValidate() { return validate; }
    public Map<String, Object> getColumnUpdates() { return columnUpdates; }
    public Map<String, Map<String, Object>> getFieldMerges() { return fieldMerges; }
    public Instant getDeadline() { return deadline; }

    @Override
    public String toString() {
        return "TransitionRequest{" + resourceId + " -> " + toState + " by " + actor + "}";
    }

    public static final class Builder<S extends Enum<S>> {
        private final long resourceId;
        private final S toState;
        private S expectedFrom;
        private String actor;
        private String correlationId;
        private boolean validate = true;
        private final Map<String, Object> columnUpdates = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> fieldMerges = new LinkedHashMap<>();
        private Instant deadline;

        private Builder(long resourceId, S toState) {
            this.resourceId = resourceId;
            this.toState = toState;
        }

        public Builder<S> expectedFrom(S expectedFrom) { this.expectedFrom = expectedFrom; return this; }
        public Builder<S> actor(String actor) { this.actor = actor; return this; }
        public Builder<S> correlationId(String correlationId) { this.correlationId = correlationId; return this; }
        public Builder<S> validate(boolean validate) { this.validate = validate; return this; }
        public Builder<S> deadline(Instant deadline) { this.deadline = deadline; return this; }

        public Builder<S> set(String column, Object value) {
            this.columnUpdates.put(column, value);
            return this;
        }

        public Builder<S> mergeField(String field, Map<String, Object> updates) {
            this.fieldMerges.put(field, updates);
            return this;
        }

        public TransitionRequest<S> build() {
            return new TransitionRequest<>(this);
        }
    }
}
