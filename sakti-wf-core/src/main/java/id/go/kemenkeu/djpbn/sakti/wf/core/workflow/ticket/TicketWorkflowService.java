package id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.InvalidTransitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceDescriptor;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.retry.RetryPolicyName;
import id.go.kemenkeu.djpbn.sakti.wf.core.statemachine.StateMachine;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.AbstractWorkflowTransitionService;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.RowChange;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.WorkflowEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket.TicketStatus.*;

/**
 * Helpdesk tickets. Every change is appended to
 * {@code ticket_log.ticket_history}, bounded to the configured length.
 */
public class TicketWorkflowService extends AbstractWorkflowTransitionService<TicketStatus> {

    public static final String RESOURCE_TYPE = "ticket";

    public static final String COL_LEVEL = "level";
    public static final String COL_IS_ESCALATED = "is_escalated";
    public static final String COL_ASSIGNED_TO_PEOPLE = "assigned_to_people";
    public static final String COL_ASSIGNED_TO_GROUP = "assigned_to_group";
    public static final String COL_TICKET_LOG = "ticket_log";
    public static final String HISTORY_KEY = "ticket_history";

    public static final int DEFAULT_HISTORY_MAX_LENGTH = 50;

    private final int historyMaxLength;

    public TicketWorkflowService(WorkflowEngine engine) {
        this(engine, descriptor("ticket"), DEFAULT_HISTORY_MAX_LENGTH);
    }

    public TicketWorkflowService(WorkflowEngine engine, ResourceDescriptor descriptor, int historyMaxLength) {
        super(engine, descriptor, stateMachine());
        if (historyMaxLength < 1) {
            throw new IllegalArgumentException("historyMaxLength must be at least 1");
        }
        this.historyMaxLength = historyMaxLength;
    }

    public static ResourceDescriptor descriptor(String table) {
        return ResourceDescriptor.builder(RESOURCE_TYPE, table)
            .structuredColumn(COL_TICKET_LOG)
            .writableColumn(COL_LEVEL, COL_IS_ESCALATED, COL_ASSIGNED_TO_PEOPLE, COL_ASSIGNED_TO_GROUP)
            .build();
    }

    public static StateMachine<TicketStatus> stateMachine() {
        return StateMachine.builder(TicketStatus.class)
            .allow(NEW, OPEN, ONHOLD, RESOLVED, CANCELLED)
            .allow(OPEN, ONHOLD, RESOLVED, CLOSED, CANCELLED)
            .allow(ONHOLD, OPEN, RESOLVED, CANCELLED)
            .allow(RESOLVED, OPEN, CLOSED)
            .terminal(CLOSED, CANCELLED)
            .build();
    }

    /**
     * Raise the escalation level by one. The ticket moves to the escalation
     * person or group when one is given and keeps its assignees otherwise.
     */
    public ResourceRow escalate(long ticketId, String escalateToPeople, String escalateToGroup, String actor) {
        return single(execute("escalate", ticketId, actor, null, null, RetryPolicyName.HIGH_CONTENTION, () -> {
            ResourceRow ticket = lockRow(ticketId);
            TicketStatus status = requireOpen(ticket, "escalate");

            Long current = ticket.getLong(COL_LEVEL);
            int from = current != null ? current.intValue() : 0;
            int to = from + 1;

            Map<String, Object> changes = new LinkedHashMap<>();
            changes.put(COL_LEVEL, to);
            changes.put(COL_IS_ESCALATED, Boolean.TRUE);
            boolean reassigned = escalateToPeople != null || escalateToGroup != null;
            if (reassigned) {
                changes.put(COL_ASSIGNED_TO_PEOPLE, escalateToPeople);
                changes.put(COL_ASSIGNED_TO_GROUP, escalateToGroup);
            }

            Map<String, Object> entry = historyEntry("ESCALATED", actor, status);
            entry.put("previous_level", from);
            entry.put("level", to);
            entry.put("assigned_to_people", reassigned ? escalateToPeople : ticket.getString(COL_ASSIGNED_TO_PEOPLE));
            entry.put("assigned_to_group", reassigned ? escalateToGroup : ticket.getString(COL_ASSIGNED_TO_GROUP));
            appendInto(ticket, changes, COL_TICKET_LOG, HISTORY_KEY, entry, historyMaxLength);

            return Collections.singletonList(write("escalate", ticket, changes));
        }));
    }

    public ResourceRow escalate(long ticketId, String actor) {
        return escalate(ticketId, null, null, actor);
    }

    public ResourceRow appendHistory(long ticketId, Map<String, Object> details, String actor) {
        precheck("append_history", ticketId, actor, null, () -> {
            if (details == null || details.isEmpty()) {
                throw new ValidationException("History entry cannot be empty");
            }
            engine.getShapeValidator().validateValue(details);
        });
        return single(execute("append_history", ticketId, actor, null, null, RetryPolicyName.HIGH_CONTENTION, () -> {
            ResourceRow ticket = lockRow(ticketId);
            TicketStatus status = stateMachine.parse(ticket.getStatus());
            Map<String, Object> entry = historyEntry("COMMENT", actor, status);
            entry.putAll(details);
            Map<String, Object> changes = new LinkedHashMap<>();
            appendInto(ticket, changes, COL_TICKET_LOG, HISTORY_KEY, entry, historyMaxLength);
            return Collections.singletonList(write("append_history", ticket, changes));
        }));
    }

    /**
     * Assign to a person and/or group. A NEW ticket is opened by its first assignment.
     */
    public ResourceRow assign(long ticketId, String people, String group, String actor) {
        precheck("assign", ticketId, actor, null, () -> {
            if (people == null && group == null) {
                throw new ValidationException("Assign needs a person or a group");
            }
        });
        return single(execute("assign", ticketId, actor, null, null, RetryPolicyName.DEFAULT, () -> {
            ResourceRow ticket = lockRow(ticketId);
            TicketStatus status = requireOpen(ticket, "assign");

            Map<String, Object> columns = new LinkedHashMap<>();
            columns.put(COL_ASSIGNED_TO_PEOPLE, people);
            columns.put(COL_ASSIGNED_TO_GROUP, group);
            Map<String, Object> entry = historyEntry("ASSIGNED", actor, status);
            entry.put("assigned_to_people", people);
            entry.put("assigned_to_group", group);
            appendInto(ticket, columns, COL_TICKET_LOG, HISTORY_KEY, entry, historyMaxLength);

            if (status == NEW) {
                return Collections.singletonList(applyTransition("assign", ticket, NEW, OPEN, true,
                    columns, Collections.<String, Map<String, Object>>emptyMap()));
            }
            return Collections.singletonList(write("assign", ticket, columns));
        }));
    }

    @Override
    protected void beforeWrite(ResourceRow current, TicketStatus from, TicketStatus to, Map<String, Object> changes) {
        if (changes.containsKey(COL_TICKET_LOG)) {
            return;
        }
        Map<String, Object> entry = historyEntry("STATUS_CHANGED", null, from);
        entry.put("new_status", to.name());
        appendInto(current, changes, COL_TICKET_LOG, HISTORY_KEY, entry, historyMaxLength);
    }

    public int getHistoryMaxLength() {
        return historyMaxLength;
    }

    private TicketStatus requireOpen(ResourceRow ticket, String action) {
        TicketStatus status = stateMachine.parse(ticket.getStatus());
        if (stateMachine.isTerminal(status)) {
            throw new InvalidTransitionException(status.name(), status.name(), "cannot " + action + " a " + status + " ticket");
        }
        return status;
    }

    private Map<String, Object> historyEntry(String action, String actor, TicketStatus status) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("action", action);
        if (actor != null) {
            entry.put("actor", actor);
        }
        entry.put("status", status.name());
        entry.put("at", engine.getClock().instant().toString());
        return entry;
    }

    private static ResourceRow single(List<RowChange> changes) {
        return changes.get(0).getAfter();
    }
}
