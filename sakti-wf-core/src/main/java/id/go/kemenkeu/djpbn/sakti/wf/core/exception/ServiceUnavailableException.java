package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Retries exhausted on a contention or infrastructure failure.
 * The last underlying failure is kept as the cause.
 */
public class ServiceUnavailableException extends WorkflowException {

    private final int attempts;

    public ServiceUnavailableException(String operation, int attempts, String correlationId, Throwable cause) {
        super(ErrorKind.SERVICE_UNAVAILABLE,
            String.format("%s gave up after %d attempt(s)", operation, attempts),
            "Layanan sedang sibuk. Silakan coba beberapa saat lagi (ref: " + correlationId + ").",
            cause);
        this.attempts = attempts;
        withCorrelationId(correlationId);
    }

    public int getAttempts() {
        return attempts;
    }

    public ErrorKind getLastFailureKind() {
        Throwable cause = getCause();
        return cause instanceof WorkflowException ? ((WorkflowException) cause).getKind() : null;
    }
}
