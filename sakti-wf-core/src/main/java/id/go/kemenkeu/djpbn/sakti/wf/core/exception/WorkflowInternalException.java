package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

/**
 * Unexpected failure (usually a database error that is not transient).
 * The transaction it happened in has already been rolled back.
 */
public class WorkflowInternalException extends WorkflowException {

    public WorkflowInternalException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, "Terjadi kesalahan sistem.", cause);
    }
}
