package id.go.kemenkeu.djpbn.sakti.wf.core.workflow.ticket;

public enum TicketStatus {
    NEW,
    OPEN,
    ONHOLD,
    RESOLVED,
    CLOSED,
    CANCELLED
}
