package id.go.kemenkeu.djpbn.sakti.wf.core.field;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditEntry;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditOutcome;
import id.go.kemenkeu.djpbn.sakti.wf.core.context.CorrelationContext;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowInternalException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceDescriptor;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.SectionTiming;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Read-merge-write of JSON columns inside the resource's critical section.
 *
 * <p>Each call takes the distributed mutex, opens a transaction, row-locks the
 * resource, re-reads the column, applies the change and writes back only that
 * column plus the version. Nothing read before the lock is trusted.</p>
 */
public class AtomicStructuredFieldUpdater {

    private static final Logger log = LoggerFactory.getLogger(AtomicStructuredFieldUpdater.class);

    private static final String SYSTEM_ACTOR = "system";

    private final WorkflowEngine engine;

    public AtomicStructuredFieldUpdater(WorkflowEngine engine) {
        if (engine == null) {
            throw new IllegalArgumentException("WorkflowEngine cannot be null");
        }
        this.engine = engine;
    }

    public Map<String, Object> mergeField(ResourceDescriptor descriptor, long id, String field,
                                          Map<String, Object> updates) {
        return mergeField(descriptor, id, field, updates, SYSTEM_ACTOR);
    }

    public Map<String, Object> mergeField(ResourceDescriptor descriptor, long id, String field,
                                          Map<String, Object> updates, String actor) {
        engine.getShapeValidator().validateField(descriptor, field);
        if (updates == null) {
            throw new ValidationException("Updates cannot be null");
        }
        engine.getShapeValidator().validateValue(updates);
        return update("merge_field", descriptor, id, field, actor,
            current -> StructuredFields.deepMerge(current, updates));
    }

    public Map<String, Object> appendToArray(ResourceDescriptor descriptor, long id, String field,
                                             String arrayKey, Object item, Integer maxLength) {
        return appendToArray(descriptor, id, field, arrayKey, item, maxLength, SYSTEM_ACTOR);
    }

    public Map<String, Object> appendToArray(ResourceDescriptor descriptor, long id, String field,
                                             String arrayKey, Object item, Integer maxLength, String actor) {
        engine.getShapeValidator().validateField(descriptor, field);
        engine.getShapeValidator().validateValue(item);
        if (maxLength != null && maxLength < 1) {
            throw new ValidationException("maxLength must be at least 1");
        }
        return update("append_to_array", descriptor, id, field, actor,
            current -> StructuredFields.appendBounded(current, arrayKey, item, maxLength));
    }

    /**
     * Hand {@code transformer} a private copy of the field. The copy is written
     * when the transformer returns and discarded if it throws.
     */
    public Map<String, Object> withField(ResourceDescriptor descriptor, long id, String field,
                                         FieldTransformer transformer) {
        return withField(descriptor, id, field, transformer, SYSTEM_ACTOR);
    }

    public Map<String, Object> withField(ResourceDescriptor descriptor, long id, String field,
                                         FieldTransformer transformer, String actor) {
        engine.getShapeValidator().validateField(descriptor, field);
        if (transformer == null) {
            throw new ValidationException("Transformer cannot be null");
        }
        return update("with_field", descriptor, id, field, actor, current -> {
            try {
                transformer.transform(current);
                return current;
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new WorkflowInternalException("Field transformer failed on " + field, e);
            }
        });
    }

    private Map<String, Object> update(String operation, ResourceDescriptor descriptor, long id,
                                       String field, String actor,
                                       UnaryOperator<Map<String, Object>> transformation) {
        try (CorrelationContext ctx = CorrelationContext.open(null)) {
            String correlationId = ctx.getCorrelationId();
            SectionTiming timing = new SectionTiming();
            String lockKey = engine.lockKey(descriptor.getResourceType(), id);
            try {
                FieldWrite write = engine.getRetryExecutor().execute(
                    operation + " " + descriptor.getResourceType() + "." + field,
                    RetryPolicyName.HIGH_CONTENTION, correlationId,
                    () -> engine.getCriticalSection().execute(lockKey, null, timing,
                        status -> applyLocked(descriptor, id, field, transformation)));

                engine.getMetrics().recordFieldUpdate();
                record(operation, descriptor, id, field, actor, correlationId, timing,
                    AuditOutcome.APPLIED, null, write.before, write.after);
                log.debug("{} {} {}.{} by {}", operation, descriptor.getResourceType(), id, field, actor);
                return write.after;
            } catch (WorkflowException e) {
                record(operation, descriptor, id, field, actor, correlationId, timing,
                    AuditOutcome.forFailure(e.getKind()), e, null, null);
                throw e.withCorrelationId(correlationId);
            }
        }
    }

    private FieldWrite applyLocked(ResourceDescriptor descriptor, long id, String field,
                                              UnaryOperator<Map<String, Object>> transformation) {
        ResourceRow row = engine.getRowLocks().lockForUpdate(descriptor, id);
        Map<String, Object> before = engine.getCodec().readMap(row.get(field));
        Map<String, Object> after = transformation.apply(StructuredFields.deepCopy(before));
        engine.getShapeValidator().validateValue(after);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(field, engine.getCodec().write(after));
        engine.getRecords().writeVersioned(row, changes, engine.getClock().instant());
        return new FieldWrite(before, after);
    }

    private void record(String operation, ResourceDescriptor descriptor, long id, String field,
                        String actor, String correlationId, SectionTiming timing, AuditOutcome outcome,
                        WorkflowException failure, Map<String, Object> before, Map<String, Object> after) {
        engine.getAuditRecorder().record(AuditEntry.builder()
            .resourceType(descriptor.getResourceType())
            .resourceId(id)
            .operation(operation + ":" + field)
            .outcome(outcome)
            .oldValue(before != null ? Collections.<String, Object>singletonMap(field, before) : null)
            .newValue(after != null ? Collections.<String, Object>singletonMap(field, after) : null)
            .actor(actor)
            .lockWaitMs(timing.getLockWaitMs())
            .txDurationMs(timing.getTxDurationMs())
            .correlationId(correlationId)
            .errorKind(failure != null ? failure.getKind() : null)
            .timestamp(engine.getClock().instant())
            .build());
    }

    private static final class FieldWrite {
        private final Map<String, Object> before;
        private final Map<String, Object> after;

        private FieldWrite(Map<String, Object> before, Map<String, Object> after) {
            this.before = before;
            this.after = after;
        }
    }
}
