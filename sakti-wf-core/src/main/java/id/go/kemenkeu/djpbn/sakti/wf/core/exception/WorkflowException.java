package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Base of every error that crosses the engine boundary.
 *
 * <p>{@link #getMessage()} is for logs and may name internal details such as
 * lock keys. {@link #getPublicMessage()} is the only text a caller should show
 * to an end user.</p>
 */
public abstract class WorkflowException extends RuntimeException {

    private final ErrorKind kind;
    private final String publicMessage;
    private volatile String correlationId;

    protected WorkflowException(ErrorKind kind, String message, String publicMessage) {
        this(kind, message, publicMessage, null);
    }

    protected WorkflowException(ErrorKind kind, String message, String publicMessage, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("ErrorKind cannot be null");
        }
        this.kind = kind;
        this.publicMessage = publicMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }

    public String getPublicMessage() {
        return publicMessage;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    /**
     * Attach the correlation id unless one is already present.
     */
    public WorkflowException withCorrelationId(String correlationId) {
        if (this.correlationId == null) {
            this.correlationId = correlationId;
        }
        return this;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(super.toString());
        sb.append(" [kind=").append(kind);
        if (correlationId != null) {
            sb.append(", correlationId=").append(correlationId);
        }
        sb.append("]");
        return sb.toString();
    }
}
