package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Requested state change is not in the legal-transition table, or one of its
 * preconditions does not hold.
 */
public class InvalidTransitionException extends WorkflowException {

    private final String fromState;
    private final String toState;

    public InvalidTransitionException(String fromState, String toState, String reason) {
        super(ErrorKind.INVALID_TRANSITION,
            String.format("Invalid transition %s -> %s: %s", fromState, toState, reason),
            String.format("Perubahan status dari %s ke %s tidak diizinkan: %s", fromState, toState, reason));
        this.fromState = fromState;
        this.toState = toState;
    }

    public String getFromState() {
        return fromState;
    }

    public String getToState() {
        return toState;
    }
}
