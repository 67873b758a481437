package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class TransientConnectionException extends WorkflowException {

    public TransientConnectionException(String message, Throwable cause) {
        super(ErrorKind.TRANSIENT_CONNECTION, message,
            "Layanan sementara tidak tersedia. Silakan coba lagi.", cause);
    }
}
