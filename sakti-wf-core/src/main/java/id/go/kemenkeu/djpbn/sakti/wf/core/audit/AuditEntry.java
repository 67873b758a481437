package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One immutable row of the audit trail.
 */
public final class AuditEntry {

    private final Long sequence;
    private final String resourceType;
    private final long resourceId;
    private final String operation;
    private final AuditOutcome outcome;
    private final Map<String, Object> oldValue;
    private final Map<String, Object> newValue;
    private final String actor;
    private final long lockWaitMs;
    private final long txDurationMs;
    private final String correlationId;
    private final ErrorKind errorKind;
    private final Instant timestamp;

    private AuditEntry(Builder b) {
        if (b.resourceType == null || b.operation == null || b.outcome == null) {
            throw new IllegalArgumentException("resourceType, operation and outcome are required");
        }
        this.sequence = b.sequence;
        this.resourceType = b.resourceType;
        this.resourceId = b.resourceId;
        this.operation = b.operation;
        this.outcome = b.outcome;
        this.oldValue = freeze(b.oldValue);
        this.newValue = freeze(b.newValue);
        this.actor = b.actor;
        this.lockWaitMs = b.lockWaitMs;
        this.txDurationMs = b.txDurationMs;
        this.correlationId = b.correlationId;
        this.errorKind = b.errorKind;
        this.timestamp = b.timestamp != null ? b.timestamp : Instant.now();
    }

    private static Map<String, Object> freeze(Map<String, Object> value) {
        return value == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(value));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Store-assigned position, null until persisted. */
    public Long getSequence() { return sequence; }
    public String getResourceType() { return resourceType; }
    public long getResourceId() { return resourceId; }
    public String getOperation() { return operation; }
    public AuditOutcome getOutcome() { return outcome; }
    public Map<String, Object> getOldValue() { return oldValue; }
    public Map<String, Object> getNewValue() { return newValue; }
    public String getActor() { return actor; }
    public long getLockWaitMs() { return lockWaitMs; }
    public long getTxDurationMs() { return txDurationMs; }
    public String getCorrelationId() { return correlationId; }
    public ErrorKind getErrorKind() { return errorKind; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return String.format("AuditEntry{%s %d %s %s by %s, cid=%s}",
            resourceType, resourceId, operation, outcome, actor, correlationId);
    }

    public static final class Builder {
        private Long sequence;
        private String resourceType;
        private long resourceId;
        private String operation;
        private AuditOutcome outcome;
        private Map<String, Object> oldValue;
        private Map<String, Object> newValue;
        private String actor;
        private long lockWaitMs;
        private long txDurationMs;
        private String correlationId;
        private ErrorKind errorKind;
        private Instant timestamp;

        private Builder() {
        }

        public Builder sequence(Long sequence) { this.sequence = sequence; return this; }
        public Builder resourceType(String resourceType) { this.resourceType = resourceType; return this; }
        public Builder resourceId(long resourceId) { this.resourceId = resourceId; return this; }
        public Builder operation(String operation) { this.operation = operation; return this; }
        public Builder outcome(AuditOutcome outcome) { this.outcome = outcome; return this; }
        public Builder oldValue(Map<String, Object> oldValue) { this.oldValue = oldValue; return this; }
        public Builder newValue(Map<String, Object> newValue) { this.newValue = newValue; return this; }
        public Builder actor(String actor) { this.actor = actor; return this; }
        public Builder lockWaitMs(long lockWaitMs) { this.lockWaitMs = lockWaitMs; return this; }
        public Builder txDurationMs(long txDurationMs) { this.txDurationMs = txDurationMs; return this; }
        public Builder correlationId(String correlationId) { this.correlationId = correlationId; return this; }
        public Builder errorKind(ErrorKind errorKind) { this.errorKind = errorKind; return this; }
        public Builder timestamp(Instant timestamp) { this.timestamp = timestamp; return this; }

        public AuditEntry build() {
            return new AuditEntry(this);
        }
    }
}
