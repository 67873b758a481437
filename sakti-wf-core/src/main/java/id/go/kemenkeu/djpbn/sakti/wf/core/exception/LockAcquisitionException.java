package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class LockAcquisitionException extends WorkflowException {

    private static final String PUBLIC_MESSAGE = "Data sedang diproses. Silakan tunggu beberapa saat.";

    public LockAcquisitionException(String message) {
        super(ErrorKind.LOCK_ACQUISITION, message, PUBLIC_MESSAGE);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(ErrorKind.LOCK_ACQUISITION, message, PUBLIC_MESSAGE, cause);
    }
}
