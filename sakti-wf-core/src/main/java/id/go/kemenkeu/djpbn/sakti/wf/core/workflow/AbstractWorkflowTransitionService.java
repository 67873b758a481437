package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditEntry;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditOutcome;
import id.go.kemenkeu.djpbn.sakti.wf.core.context.CorrelationContext;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.InvalidTransitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowException;
import id.go.kemenkeu.djpbn.sakti.wf.core.field.StructuredFields;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceDescriptor;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.statemachine.StateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Stream;

/**
 * Status transitions for one entity type.
 *
 * <p>Every public operation follows the same path: retry policy, distributed
 * mutex keyed by the resource (the parent for coupled and bulk updates),
 * one transaction, row locks, state-machine check, versioned write, commit,
 * mutex release, then one audit entry per written row. A refused or failed
 * attempt still leaves an audit entry.</p>
 *
 * <p>Subclasses add domain operations by composing {@link #execute},
 * {@link #lockRow}, {@link #applyTransition} and {@link #write}.</p>
 */
public abstract class AbstractWorkflowTransitionService<S extends Enum<S>> {

    private static final Logger log = LoggerFactory.getLogger(AbstractWorkflowTransitionService.class);

    protected final WorkflowEngine engine;
    protected final ResourceDescriptor descriptor;
    protected final StateMachine<S> stateMachine;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();

    protected AbstractWorkflowTransitionService(WorkflowEngine engine, ResourceDescriptor descriptor,
                                                StateMachine<S> stateMachine) {
        if (engine == null || descriptor == null || stateMachine == null) {
            throw new IllegalArgumentException("engine, descriptor and stateMachine are required");
        }
        this.engine = engine;
        this.descriptor = descriptor;
        this.stateMachine = stateMachine;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public ResourceDescriptor getDescriptor() {
        return descriptor;
    }

    public StateMachine<S> getStateMachine() {
        return stateMachine;
    }

    // ------------------------------------------------------------------
    // transition
    // ------------------------------------------------------------------

    public ResourceRow transition(long resourceId, S newState, String actor) {
        return transition(TransitionRequest.builder(resourceId, newState).actor(actor).build());
    }

    public ResourceRow transition(long resourceId, S newState, String actor, boolean validate) {
        return transition(TransitionRequest.builder(resourceId, newState).actor(actor).validate(validate).build());
    }

    public ResourceRow transition(TransitionRequest<S> request) {
        precheck("transition", request.getResourceId(), request.getActor(), request.getCorrelationId(),
            () -> validateFieldMerges(request.getFieldMerges()));
        List<RowChange> changes = execute("transition", request.getResourceId(), request.getActor(),
            request.getCorrelationId(), request.getDeadline(), RetryPolicyName.DEFAULT, () -> {
                ResourceRow current = lockRow(request.getResourceId());
                return Collections.singletonList(applyTransition("transition", current,
                    request.getExpectedFrom(), request.getToState(), request.isValidate(),
                    request.getColumnUpdates(), request.getFieldMerges()));
            });
        return changes.get(0).getAfter();
    }

    // ------------------------------------------------------------------
    // parent / child
    // ------------------------------------------------------------------

    public CoupledUpdateResult updateCoupledParentChild(ChildUpdate<S> child, long parentId, String actor) {
        return updateCoupledParentChild(child, parentId, Collections.<String, Object>emptyMap(), actor, null);
    }

    /**
     * Update a child and its parent in one transaction under the parent's
     * mutex. The child is written first; if the parent write fails both roll back.
     */
    public CoupledUpdateResult updateCoupledParentChild(ChildUpdate<S> child, long parentId,
                                                        Map<String, Object> parentUpdates,
                                                        String actor, String correlationId) {
        precheck("update_parent_child", parentId, actor, correlationId, this::requireParentColumn);
        List<RowChange> changes = execute("update_parent_child", parentId, actor, correlationId, null,
            RetryPolicyName.MULTI_ROW, () -> {
                ResourceRow parent = lockRow(parentId);
                ResourceRow childRow = engine.getRowLocks().lockForUpdate(descriptor, child.getChildId());
                requireChildOf(childRow, parentId);

                RowChange childChange = applyChildUpdate(childRow, child);
                RowChange parentChange = writeParent(parent,
                    Collections.singletonList(childChange.getAfter()), parentUpdates);
                List<RowChange> out = new ArrayList<>(2);
                out.add(childChange);
                out.add(parentChange);
                return out;
            });
        return new CoupledUpdateResult(changes.get(1).getAfter(), changes.get(0).getAfter());
    }

    public List<ResourceRow> bulkTransition(long parentId, List<ChildUpdate<S>> updates, String actor) {
        return bulkTransition(parentId, updates, actor, null);
    }

    /**
     * Apply every child update or none. Children are locked in ascending id order.
     *
     * @return the updated children, ascending by id
     */
    public List<ResourceRow> bulkTransition(long parentId, List<ChildUpdate<S>> updates,
                                            String actor, String correlationId) {
        Map<Long, ChildUpdate<S>> byId = new LinkedHashMap<>();
        precheck("bulk_transition", parentId, actor, correlationId, () -> {
            requireParentColumn();
            if (updates == null || updates.isEmpty()) {
                throw new ValidationException("No child updates given");
            }
            for (ChildUpdate<S> u : updates) {
                if (byId.put(u.getChildId(), u) != null) {
                    throw new ValidationException("Duplicate child id " + u.getChildId());
                }
            }
        });

        List<RowChange> changes = execute("bulk_transition", parentId, actor, correlationId, null,
            RetryPolicyName.MULTI_ROW, () -> {
                ResourceRow parent = lockRow(parentId);
                List<ResourceRow> children = engine.getRowLocks().lockAllForUpdate(descriptor, byId.keySet());
                List<RowChange> out = new ArrayList<>(children.size() + 1);
                List<ResourceRow> written = new ArrayList<>(children.size());
                for (ResourceRow childRow : children) {
                    requireChildOf(childRow, parentId);
                    RowChange c = applyChildUpdate(childRow, byId.get(childRow.getId()));
                    out.add(c);
                    written.add(c.getAfter());
                }
                out.add(writeParent(parent, written, Collections.<String, Object>emptyMap()));
                return out;
            });

        List<ResourceRow> result = new ArrayList<>(changes.size() - 1);
        for (int i = 0; i < changes.size() - 1; i++) {
            result.add(changes.get(i).getAfter());
        }
        return result;
    }

    // ------------------------------------------------------------------
    // reads
    // ------------------------------------------------------------------

    public Stream<AuditEntry> auditHistory(long resourceId) {
        return auditHistory(resourceId, null);
    }

    public Stream<AuditEntry> auditHistory(long resourceId, Instant since) {
        return engine.getAuditRecorder().history(descriptor.getResourceType(), resourceId, since);
    }

    /**
     * Unlocked read, for display only.
     */
    public ResourceRow find(long resourceId) {
        return engine.getRowLocks().read(descriptor, resourceId);
    }

    // ------------------------------------------------------------------
    // building blocks for subclasses
    // ------------------------------------------------------------------

    @FunctionalInterface
    protected interface CriticalBody {
        List<RowChange> run();
    }

    /**
     * Run {@code body} in the critical section of {@code primaryId} with retries,
     * then audit. Returns the row changes {@code body} produced.
     */
    protected List<RowChange> execute(String operation, long primaryId, String actor, String correlationId,
                                      Instant deadline, RetryPolicyName policy, CriticalBody body) {
        try (CorrelationContext ctx = CorrelationContext.open(correlationId)) {
            String cid = ctx.getCorrelationId();
            SectionTiming timing = new SectionTiming();
            String lockKey = engine.lockKey(descriptor.getResourceType(), primaryId);
            String opName = operation + " " + descriptor.getResourceType() + " " + primaryId;
            try {
                List<RowChange> changes = engine.getRetryExecutor().execute(opName,
                    engine.getRetryExecutor().policy(policy), cid, deadline,
                    () -> engine.getCriticalSection().execute(lockKey, deadline, timing, status -> body.run()));

                if (!changes.isEmpty()) {
                    engine.getMetrics().recordTransitionApplied();
                }
                for (RowChange change : changes) {
                    audit(change.getOperation(), change.getAfter().getId(), actor, cid, timing,
                        AuditOutcome.APPLIED, null, auditValue(change.getBefore(), change.getChanges().keySet()),
                        auditValue(change.getAfter(), change.getChanges().keySet()));
                }
                log.info("{} applied by {}: {} row(s), lock wait {}ms, tx {}ms",
                    opName, actor, changes.size(), timing.getLockWaitMs(), timing.getTxDurationMs());
                return changes;

            } catch (InvalidTransitionException e) {
                engine.getMetrics().recordTransitionRejected();
                audit(operation, primaryId, actor, cid, timing, AuditOutcome.REJECTED, e.getKind(),
                    singleton(descriptor.getStatusColumn(), e.getFromState()),
                    singleton(descriptor.getStatusColumn(), e.getToState()));
                log.info("{} rejected: {}", opName, e.getMessage());
                throw e.withCorrelationId(cid);

            } catch (WorkflowException e) {
                AuditOutcome outcome = AuditOutcome.forFailure(e.getKind());
                if (outcome == AuditOutcome.REJECTED) {
                    engine.getMetrics().recordTransitionRejected();
                } else {
                    engine.getMetrics().recordTransitionFailed(e.getKind());
                }
                audit(operation, primaryId, actor, cid, timing, outcome, e.getKind(), null, null);
                if (e.getKind() == ErrorKind.INTERNAL) {
                    log.error("{} failed: {}", opName, e.getMessage());
                } else {
                    log.warn("{} {}: {}", opName, outcome, e.getMessage());
                }
                throw e.withCorrelationId(cid);
            }
        }
    }

    /**
     * Argument checks that need no lock. A refusal here is audited as
     * REJECTED, the same as one raised inside the critical section.
     */
    protected void precheck(String operation, long resourceId, String actor, String correlationId,
                            Runnable check) {
        try {
            check.run();
        } catch (ValidationException e) {
            try (CorrelationContext ctx = CorrelationContext.open(correlationId)) {
                String cid = ctx.getCorrelationId();
                engine.getMetrics().recordTransitionRejected();
                audit(operation, resourceId, actor, cid, new SectionTiming(), AuditOutcome.REJECTED,
                    e.getKind(), null, null);
                log.info("{} {} {} rejected before locking: {}",
                    operation, descriptor.getResourceType(), resourceId, e.getMessage());
                throw e.withCorrelationId(cid);
            }
        }
    }

    protected ResourceRow lockRow(long resourceId) {
        return engine.getRowLocks().lockForUpdate(descriptor, resourceId);
    }

    /**
     * Move a locked row to {@code to}. Must run inside {@link #execute}.
     */
    protected RowChange applyTransition(String operation, ResourceRow current, S expectedFrom, S to,
                                        boolean validate, Map<String, Object> columnUpdates,
                                        Map<String, Map<String, Object>> fieldMerges) {
        S from = stateMachine.parse(current.getStatus());
        if (expectedFrom != null && expectedFrom != from) {
            throw new InvalidTransitionException(from.name(), to.name(),
                "expected " + expectedFrom + " but found " + from);
        }
        Map<String, Object> changes = new LinkedHashMap<>(columnUpdates);
        for (Map.Entry<String, Map<String, Object>> merge : fieldMerges.entrySet()) {
            mergeInto(current, changes, merge.getKey(), merge.getValue());
        }
        changes.put(descriptor.getStatusColumn(), to.name());
        if (validate) {
            stateMachine.validate(from, to, current, changes);
        }
        beforeWrite(current, from, to, changes);
        return write(operation, current, changes);
    }

    /**
     * Versioned write of {@code changes} on a locked row, then listeners.
     */
    protected RowChange write(String operation, ResourceRow current, Map<String, Object> changes) {
        ResourceRow after = engine.getRecords().writeVersioned(current, changes, engine.getClock().instant());
        for (TransitionListener listener : listeners) {
            listener.beforeCommit(operation, current, after);
        }
        return new RowChange(operation, current, after, changes);
    }

    /**
     * Deep-merge {@code updates} into a structured column, reading either the
     * pending value in {@code changes} or the locked row's value.
     */
    protected void mergeInto(ResourceRow current, Map<String, Object> changes, String field,
                             Map<String, Object> updates) {
        Map<String, Object> base = engine.getCodec().readMap(
            changes.containsKey(field) ? changes.get(field) : current.get(field));
        changes.put(field, engine.getCodec().write(StructuredFields.deepMerge(base, updates)));
    }

    protected void appendInto(ResourceRow current, Map<String, Object> changes, String field,
                              String arrayKey, Object item, Integer maxLength) {
        Map<String, Object> base = engine.getCodec().readMap(
            changes.containsKey(field) ? changes.get(field) : current.get(field));
        changes.put(field, engine.getCodec().write(StructuredFields.appendBounded(base, arrayKey, item, maxLength)));
    }

    /**
     * Last chance to add columns to a transition write. Runs after validation.
     */
    protected void beforeWrite(ResourceRow current, S from, S to, Map<String, Object> changes) {
    }

    /**
     * Columns derived on the parent from its freshly written children.
     * Runs while parent and children are locked.
     */
    protected Map<String, Object> deriveParentChanges(ResourceRow parent, List<ResourceRow> updatedChildren) {
        return Collections.emptyMap();
    }

    protected void validateFieldMerges(Map<String, Map<String, Object>> fieldMerges) {
        for (Map.Entry<String, Map<String, Object>> e : fieldMerges.entrySet()) {
            engine.getShapeValidator().validateField(descriptor, e.getKey());
            engine.getShapeValidator().validateValue(e.getValue());
        }
    }

    // ------------------------------------------------------------------

    private RowChange applyChildUpdate(ResourceRow childRow, ChildUpdate<S> update) {
        if (update.getToState() != null) {
            return applyTransition("child_transition", childRow, null, update.getToState(), true,
                update.getColumnUpdates(), Collections.<String, Map<String, Object>>emptyMap());
        }
        if (update.getColumnUpdates().isEmpty()) {
            throw new ValidationException("Child update for " + update.getChildId() + " changes nothing");
        }
        return write("child_update", childRow, new LinkedHashMap<>(update.getColumnUpdates()));
    }

    private RowChange writeParent(ResourceRow parent, List<ResourceRow> children, Map<String, Object> parentUpdates) {
        Map<String, Object> changes = new LinkedHashMap<>(deriveParentChanges(parent, children));
        changes.putAll(parentUpdates);
        return write("parent_update", parent, changes);
    }

    private void requireChildOf(ResourceRow child, long parentId) {
        Long actualParent = child.getParentId();
        if (actualParent == null || actualParent != parentId) {
            throw new ValidationException(descriptor.getResourceType() + " " + child.getId()
                + " is not a child of " + parentId);
        }
    }

    private void requireParentColumn() {
        if (!descriptor.hasParent()) {
            throw new ValidationException(descriptor.getResourceType() + " has no parent/child relation");
        }
    }

    private void audit(String operation, long resourceId, String actor, String correlationId, SectionTiming timing,
                       AuditOutcome outcome, ErrorKind errorKind,
                       Map<String, Object> oldValue, Map<String, Object> newValue) {
        engine.getAuditRecorder().record(AuditEntry.builder()
            .resourceType(descriptor.getResourceType())
            .resourceId(resourceId)
            .operation(operation)
            .outcome(outcome)
            .oldValue(oldValue)
            .newValue(newValue)
            .actor(actor)
            .lockWaitMs(timing.getLockWaitMs())
            .txDurationMs(timing.getTxDurationMs())
            .correlationId(correlationId)
            .errorKind(errorKind)
            .timestamp(engine.getClock().instant())
            .build());
    }

    private Map<String, Object> auditValue(ResourceRow row, Collection<String> columns) {
        Map<String, Object> value = new LinkedHashMap<>();
        for (String column : columns) {
            Object v = row.get(column);
            if (v != null && descriptor.isStructured(column)) {
                v = engine.getCodec().readMap(v);
            } else if (v instanceof Timestamp) {
                v = ((Timestamp) v).toInstant().toString();
            }
            value.put(column, v);
        }
        value.put(descriptor.getVersionColumn(), row.getVersion());
        return value;
    }

    private static Map<String, Object> singleton(String key, Object value) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(key, value);
        return m;
    }
}
