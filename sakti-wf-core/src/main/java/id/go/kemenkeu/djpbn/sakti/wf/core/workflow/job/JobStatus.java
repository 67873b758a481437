package id.go.kemenkeu.djpbn.sakti.wf.core.workflow.job;

public enum JobStatus {
    ASSIGNED,
    INPROGRESS,
    WORKING,
    STANDBY,
    MAINTENANCE,
    PARTIALLYCOMPLETED,
    COMPLETED,
    AUTOCLOSED;

    public boolean isClosed() {
        return this == COMPLETED || this == AUTOCLOSED;
    }
}
