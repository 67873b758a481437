package id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job;

import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceDescriptor;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.statemachine.StateMachine;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.AbstractWorkflowTransitionService;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ChildUpdate;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.CoupledUpdateResult;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.RowChange;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.TransitionRequest;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job.JobStatus.*;

/**
 * Scheduled jobs and their tour checkpoints. Checkpoints are rows of the same
 * table whose parent column points at the tour.
 */
public class JobWorkflowService extends AbstractWorkflowTransitionService<JobStatus> {

    private static final Logger log = LoggerFactory.getLogger(JobWorkflowService.class);

    public static final String RESOURCE_TYPE = "job";

    public static final String COL_IDENTIFIER = "identifier";
    public static final String COL_START_TIME = "start_time";
    public static final String COL_COMPLETED_AT = "completed_at";
    public static final String COL_ASSIGNED_TO = "assigned_to";
    public static final String COL_CHECKPOINTS_TOTAL = "checkpoints_total";
    public static final String COL_CHECKPOINTS_COMPLETED = "checkpoints_completed";
    public static final String COL_OTHER_INFO = "other_info";

    private static final Set<String> TOUR_IDENTIFIERS =
        Collections.unmodifiableSet(new HashSet<>(Arrays.asList("INTERNALTOUR", "EXTERNALTOUR")));

    public JobWorkflowService(WorkflowEngine engine) {
        this(engine, descriptor("job"));
    }

    public JobWorkflowService(WorkflowEngine engine, ResourceDescriptor descriptor) {
        super(engine, descriptor, stateMachine());
    }

    public static ResourceDescriptor descriptor(String table) {
        return ResourceDescriptor.builder(RESOURCE_TYPE, table)
            .parentColumn("parent_id")
            .structuredColumn(COL_OTHER_INFO)
            .writableColumn(COL_START_TIME, COL_COMPLETED_AT, COL_ASSIGNED_TO,
                COL_CHECKPOINTS_TOTAL, COL_CHECKPOINTS_COMPLETED)
            .build();
    }

    public static StateMachine<JobStatus> stateMachine() {
        return StateMachine.builder(JobStatus.class)
            .allow(ASSIGNED, INPROGRESS, WORKING, STANDBY, MAINTENANCE, COMPLETED, AUTOCLOSED)
            .allow(INPROGRESS, WORKING, STANDBY, MAINTENANCE, PARTIALLYCOMPLETED, COMPLETED, AUTOCLOSED)
            .allow(WORKING, INPROGRESS, STANDBY, MAINTENANCE, PARTIALLYCOMPLETED, COMPLETED, AUTOCLOSED)
            .allow(STANDBY, INPROGRESS, WORKING, MAINTENANCE, AUTOCLOSED)
            .allow(MAINTENANCE, INPROGRESS, WORKING, STANDBY, AUTOCLOSED)
            .allow(PARTIALLYCOMPLETED, COMPLETED)
            .terminal(COMPLETED, AUTOCLOSED)
            .guard(COMPLETED, "completion time not recorded",
                (from, to, current, pending) -> pending.get(COL_COMPLETED_AT) != null
                    || current.get(COL_COMPLETED_AT) != null)
            .build();
    }

    public ResourceRow start(long jobId, String actor) {
        return transition(TransitionRequest.builder(jobId, INPROGRESS)
            .actor(actor)
            .set(COL_START_TIME, Timestamp.from(engine.getClock().instant()))
            .build());
    }

    public ResourceRow complete(long jobId, Instant completedAt, String actor) {
        return transition(TransitionRequest.builder(jobId, COMPLETED)
            .actor(actor)
            .set(COL_COMPLETED_AT, completedAt != null ? Timestamp.from(completedAt) : null)
            .build());
    }

    /**
     * Close an expired job. An in-progress tour with some, but not all,
     * checkpoints completed becomes PARTIALLYCOMPLETED, anything else that is
     * still open becomes AUTOCLOSED. Checkpoints still ASSIGNED are
     * auto-closed in the same transaction.
     *
     * @param metadata merged into {@code other_info} together with
     *                 {@code autoclosed_by_server = true}
     * @return the job as it is afterwards
     */
    public ResourceRow autoclose(long jobId, Map<String, Object> metadata, String actor) {
        Map<String, Object> info = new LinkedHashMap<>();
        if (metadata != null) {
            info.putAll(metadata);
        }
        info.put("autoclosed_by_server", true);
        precheck("autoclose", jobId, actor, null, () -> engine.getShapeValidator().validateValue(info));

        List<RowChange> changes = execute("autoclose", jobId, actor, null, null, RetryPolicyName.MULTI_ROW, () -> {
            ResourceRow job = lockRow(jobId);
            List<ResourceRow> checkpoints = tourCheckpoints(engine.getRowLocks().lockChildrenForUpdate(descriptor, jobId));
            JobStatus current = stateMachine.parse(job.getStatus());

            JobStatus target = null;
            if (current == INPROGRESS) {
                long completed = checkpoints.stream()
                    .filter(c -> COMPLETED.name().equals(c.getStatus())).count();
                target = completed > 0 && completed < checkpoints.size() ? PARTIALLYCOMPLETED : AUTOCLOSED;
            } else if (!current.isClosed() && current != PARTIALLYCOMPLETED) {
                target = AUTOCLOSED;
            }

            List<RowChange> out = new ArrayList<>();
            if (target != null) {
                out.add(applyTransition("autoclose", job, null, target, true,
                    Collections.<String, Object>emptyMap(), Collections.singletonMap(COL_OTHER_INFO, info)));
            }
            Map<String, Object> checkpointInfo = Collections.<String, Object>singletonMap("autoclosed_by_server", true);
            for (ResourceRow checkpoint : checkpoints) {
                if (ASSIGNED.name().equals(checkpoint.getStatus())) {
                    out.add(applyTransition("autoclose_checkpoint", checkpoint, ASSIGNED, AUTOCLOSED, true,
                        Collections.<String, Object>emptyMap(), Collections.singletonMap(COL_OTHER_INFO, checkpointInfo)));
                }
            }
            if (out.isEmpty()) {
                log.info("Job {} is {} with no open checkpoints, nothing to autoclose", jobId, current);
            }
            return out;
        });

        for (RowChange change : changes) {
            if (change.getAfter().getId() == jobId) {
                return change.getAfter();
            }
        }
        return find(jobId);
    }

    /**
     * Move one checkpoint and refresh the tour's checkpoint counters, both
     * under the tour's lock.
     */
    public CoupledUpdateResult updateCheckpoint(long tourId, long checkpointId, JobStatus status, String actor) {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (status == COMPLETED) {
            columns.put(COL_COMPLETED_AT, Timestamp.from(engine.getClock().instant()));
        }
        return updateCoupledParentChild(new ChildUpdate<>(checkpointId, status, columns), tourId, actor);
    }

    @Override
    protected Map<String, Object> deriveParentChanges(ResourceRow parent, List<ResourceRow> updatedChildren) {
        List<ResourceRow> children = engine.getRowLocks().lockChildrenForUpdate(descriptor, parent.getId());
        Map<Long, ResourceRow> latest = new LinkedHashMap<>();
        for (ResourceRow c : children) {
            latest.put(c.getId(), c);
        }
        for (ResourceRow c : updatedChildren) {
            latest.put(c.getId(), c);
        }
        long completed = latest.values().stream()
            .filter(c -> COMPLETED.name().equals(c.getStatus())).count();

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(COL_CHECKPOINTS_TOTAL, latest.size());
        changes.put(COL_CHECKPOINTS_COMPLETED, (int) completed);
        return changes;
    }

    private static List<ResourceRow> tourCheckpoints(List<ResourceRow> children) {
        List<ResourceRow> tour = new ArrayList<>(children.size());
        for (ResourceRow c : children) {
            String identifier = c.getString(COL_IDENTIFIER);
            if (identifier != null && TOUR_IDENTIFIERS.contains(identifier.toUpperCase(Locale.ROOT))) {
                tour.add(c);
            }
        }
        return tour;
    }
}
