package id.go.kemenkeu.djpbn.sakti.wf.core.statemachine;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.InvalidTransitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ValidationException;
import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job.JobStatus;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job.JobWorkflowService;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket.TicketStatus;
import id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket.TicketWorkflowService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StateMachine")
class StateMachineTest {

    private final StateMachine<JobStatus> jobs = JobWorkflowService.stateMachine();
    private final StateMachine<TicketStatus> tickets = TicketWorkflowService.stateMachine();

    private static ResourceRow jobRow(String status, Object completedAt) {
        Map<String, Object> columns = new HashMap<>();
        columns.put("id", 1L);
        columns.put("status", status);
        columns.put("version", 0L);
        columns.put("completed_at", completedAt);
        return ResourceRow.of(JobWorkflowService.descriptor("job"), columns);
    }

    @ParameterizedTest
    @EnumSource(value = JobStatus.class, names = {"COMPLETED", "AUTOCLOSED"})
    @DisplayName("Terminal job states have no way out")
    void terminalStatesAreClosed(JobStatus terminal) {
        assertThat(jobs.isTerminal(terminal)).isTrue();
        assertThat(jobs.allowedTargets(terminal)).isEmpty();
        for (JobStatus target : JobStatus.values()) {
            assertThat(jobs.isLegal(terminal, target)).isFalse();
        }
    }

    @Test
    @DisplayName("COMPLETED to WORKING is refused as terminal")
    void completedToWorkingIsRefused() {
        assertThatThrownBy(() -> jobs.validate(JobStatus.COMPLETED, JobStatus.WORKING,
            jobRow("COMPLETED", null), Collections.emptyMap()))
            .isInstanceOfSatisfying(InvalidTransitionException.class, e -> {
                assertThat(e.getFromState()).isEqualTo("COMPLETED");
                assertThat(e.getToState()).isEqualTo("WORKING");
            });
    }

    @Test
    @DisplayName("Moves missing from the table are refused")
    void illegalMoveIsRefused() {
        assertThat(jobs.isLegal(JobStatus.STANDBY, JobStatus.COMPLETED)).isFalse();
        assertThatThrownBy(() -> jobs.validate(JobStatus.PARTIALLYCOMPLETED, JobStatus.WORKING,
            jobRow("PARTIALLYCOMPLETED", null), Collections.emptyMap()))
            .isInstanceOf(InvalidTransitionException.class);
        assertThat(tickets.isLegal(TicketStatus.NEW, TicketStatus.CLOSED)).isFalse();
        assertThat(tickets.isLegal(TicketStatus.RESOLVED, TicketStatus.OPEN)).isTrue();
    }

    @Test
    @DisplayName("Self transitions are only legal when listed")
    void selfTransitionNeedsExplicitEntry() {
        for (JobStatus s : JobStatus.values()) {
            assertThat(jobs.isLegal(s, s)).isFalse();
        }
    }

    @Test
    @DisplayName("COMPLETED guard needs a completion time in the row or the pending write")
    void completionGuard() {
        assertThatThrownBy(() -> jobs.validate(JobStatus.WORKING, JobStatus.COMPLETED,
            jobRow("WORKING", null), Collections.emptyMap()))
            .isInstanceOf(InvalidTransitionException.class)
            .hasMessageContaining("completion time");

        Map<String, Object> pending = new HashMap<>();
        pending.put("completed_at", Timestamp.from(Instant.now()));
        jobs.validate(JobStatus.WORKING, JobStatus.COMPLETED, jobRow("WORKING", null), pending);
        jobs.validate(JobStatus.WORKING, JobStatus.COMPLETED,
            jobRow("WORKING", Timestamp.from(Instant.now())), Collections.emptyMap());
    }

    @Test
    @DisplayName("Stored values are parsed case-insensitively")
    void parseStoredValue() {
        assertThat(jobs.parse(" inprogress ")).isEqualTo(JobStatus.INPROGRESS);
        assertThatThrownBy(() -> jobs.parse("DONE")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> jobs.parse(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Builder refuses terminal states with outgoing moves")
    void builderRejectsLeakyTerminal() {
        assertThatThrownBy(() -> StateMachine.builder(TicketStatus.class)
            .allow(TicketStatus.CLOSED, TicketStatus.OPEN)
            .terminal(TicketStatus.CLOSED)
            .build())
            .isInstanceOf(IllegalStateException.class);
    }
}
