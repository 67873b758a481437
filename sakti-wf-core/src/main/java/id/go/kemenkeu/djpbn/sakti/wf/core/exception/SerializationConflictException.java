package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

public class SerializationConflictException extends WorkflowException {

    public SerializationConflictException(String message, Throwable cause) {
        super(ErrorKind.SERIALIZATION_CONFLICT, message,
            "Data sedang diproses oleh pengguna lain. Silakan coba lagi.", cause);
    }
}
