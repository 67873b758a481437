package id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket;

import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditEntry;
import id.go.kemenkeu.djpbn.sakti.wf.core.audit.AuditOutcome;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.InvalidTransitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.support.WorkflowTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TicketWorkflowService")
class TicketWorkflowServiceTest {

    private WorkflowTestDatabase db;
    private TicketWorkflowService tickets;

    @BeforeEach
    void setUp() {
        db = WorkflowTestDatabase.create();
        tickets = new TicketWorkflowService(db.engine());
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> historyOf(ResourceRow row) {
        Map<String, Object> log = db.getCodec().readMap(row.get(TicketWorkflowService.COL_TICKET_LOG));
        Object history = log.get(TicketWorkflowService.HISTORY_KEY);
        return history != null ? (List<Map<String, Object>>) history : Collections.<Map<String, Object>>emptyList();
    }

    @Test
    @DisplayName("Ten concurrent escalations raise the level by ten with ten audit entries")
    void concurrentEscalations() throws Exception {
        db.insertTicket(7L, "OPEN", 2);
        int callers = 10;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        List<Future<ResourceRow>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                String actor = "agent-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    return tickets.escalate(7L, actor);
                }));
            }
            start.countDown();
            for (Future<ResourceRow> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ResourceRow ticket = tickets.find(7L);
        assertThat(ticket.getLong(TicketWorkflowService.COL_LEVEL)).isEqualTo(12L);
        assertThat(ticket.getBoolean(TicketWorkflowService.COL_IS_ESCALATED)).isTrue();
        assertThat(ticket.getVersion()).isEqualTo(10L);
        assertThat(historyOf(ticket)).hasSize(10);

        List<AuditEntry> audit = tickets.auditHistory(7L).collect(Collectors.toList());
        assertThat(audit).hasSize(10);
        assertThat(audit).extracting(AuditEntry::getOutcome).containsOnly(AuditOutcome.APPLIED);
        assertThat(audit).extracting(AuditEntry::getOperation).containsOnly("escalate");
    }

    @Test
    @DisplayName("Escalation reassigns only when a target is given")
    void escalationReassignment() {
        db.insertTicket(1L, "OPEN", 0);
        tickets.assign(1L, "ani", "helpdesk", "lead");

        ResourceRow kept = tickets.escalate(1L, "lead");
        assertThat(kept.getString("assigned_to_people")).isEqualTo("ani");

        ResourceRow moved = tickets.escalate(1L, "rudi", "tier2", "lead");
        assertThat(moved.getString("assigned_to_people")).isEqualTo("rudi");
        assertThat(moved.getString("assigned_to_group")).isEqualTo("tier2");
        assertThat(moved.getLong("level")).isEqualTo(2L);

        Map<String, Object> last = historyOf(moved).get(historyOf(moved).size() - 1);
        assertThat(last).containsEntry("action", "ESCALATED").containsEntry("level", 2);
    }

    @Test
    @DisplayName("Closed tickets cannot be escalated")
    void closedTicketCannotEscalate() {
        db.insertTicket(1L, "CLOSED", 3);

        assertThatThrownBy(() -> tickets.escalate(1L, "lead")).isInstanceOf(InvalidTransitionException.class);
        assertThat(tickets.find(1L).getLong("level")).isEqualTo(3L);
    }

    @Test
    @DisplayName("First assignment opens a new ticket")
    void assignOpensNewTicket() {
        db.insertTicket(1L, "NEW", 0);

        ResourceRow row = tickets.assign(1L, null, "helpdesk", "dispatcher");

        assertThat(row.getStatus()).isEqualTo("OPEN");
        assertThat(row.getString("assigned_to_group")).isEqualTo("helpdesk");
        assertThat(historyOf(row)).extracting(e -> e.get("action")).containsExactly("ASSIGNED");
        assertThatThrownBy(() -> tickets.assign(1L, null, null, "dispatcher"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Assignment without a person or group is audited as REJECTED")
    void emptyAssignIsAudited() {
        db.insertTicket(2L, "NEW", 0);

        assertThatThrownBy(() -> tickets.assign(2L, null, null, "dispatcher"))
            .isInstanceOf(ValidationException.class);

        List<AuditEntry> audit = tickets.auditHistory(2L).collect(Collectors.toList());
        assertThat(audit).extracting(AuditEntry::getOutcome).containsExactly(AuditOutcome.REJECTED);
        assertThat(audit).extracting(AuditEntry::getOperation).containsExactly("assign");
        assertThat(audit).extracting(AuditEntry::getErrorKind).containsExactly(ErrorKind.VALIDATION);
        assertThat(audit.get(0).getCorrelationId()).isNotBlank();
        assertThat(tickets.find(2L).getStatus()).isEqualTo("NEW");
    }

    @Test
    @DisplayName("Status changes are recorded in the ticket history")
    void transitionAppendsHistory() {
        db.insertTicket(1L, "OPEN", 0);

        ResourceRow row = tickets.transition(1L, TicketStatus.RESOLVED, "ani");

        Map<String, Object> entry = historyOf(row).get(0);
        assertThat(entry).containsEntry("action", "STATUS_CHANGED")
            .containsEntry("status", "OPEN")
            .containsEntry("new_status", "RESOLVED");
    }

    @Test
    @DisplayName("History keeps only the newest entries")
    void historyIsBounded() {
        db.insertTicket(1L, "OPEN", 0);
        TicketWorkflowService shortHistory = new TicketWorkflowService(db.engine(),
            TicketWorkflowService.descriptor("ticket"), 3);

        for (int i = 0; i < 5; i++) {
            shortHistory.appendHistory(1L, Collections.<String, Object>singletonMap("note", "n" + i), "ani");
        }

        List<Map<String, Object>> history = historyOf(tickets.find(1L));
        assertThat(history).extracting(e -> e.get("note")).containsExactly("n2", "n3", "n4");
    }
}
