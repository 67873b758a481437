package id.go.kemenkeu.djpbn.sakti.wf.core.audit;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;

public enum AuditOutcome {
    /** Committed. */
    APPLIED,
    /** Refused by validation or the state machine; nothing was written. */
    REJECTED,
    /** Rolled back after contention, infrastructure or internal failure. */
    FAILED;

    public static AuditOutcome forFailure(ErrorKind kind) {
        return kind != null && kind.getCategory() == ErrorKind.Category.VALIDATION ? REJECTED : FAILED;
    }
}
