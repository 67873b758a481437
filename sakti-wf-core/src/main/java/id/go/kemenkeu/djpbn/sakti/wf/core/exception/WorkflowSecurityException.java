package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class WorkflowSecurityException extends WorkflowException {

    public WorkflowSecurityException(String message) {
        super(ErrorKind.SECURITY, message, "Operasi ditolak.");
    }
}
