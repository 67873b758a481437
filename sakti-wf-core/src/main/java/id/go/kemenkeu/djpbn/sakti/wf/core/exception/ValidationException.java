package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class ValidationException extends WorkflowException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, message, cause);
    }
}
