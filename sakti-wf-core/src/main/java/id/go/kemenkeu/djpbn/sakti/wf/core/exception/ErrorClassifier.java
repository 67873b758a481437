package id.go.kemenkeu.djpbn.sakti.wf.core.exception;

import org.redisson.client.RedisException;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

/**
 * Maps foreign throwables onto {@link ErrorKind} by type.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ErrorKind classify(Throwable t) {
        if (t == null) {
            return ErrorKind.INTERNAL;
        }
        if (t instanceof WorkflowException) {
            return ((WorkflowException) t).getKind();
        }
        // Row-lock wait timeouts and deadlock victims
        if (t instanceof CannotAcquireLockException) {
            return ErrorKind.LOCK_ACQUISITION;
        }
        // CannotSerializeTransactionException and other pessimistic failures
        if (t instanceof PessimisticLockingFailureException) {
            return ErrorKind.SERIALIZATION_CONFLICT;
        }
        if (t instanceof QueryTimeoutException
                || t instanceof TransactionTimedOutException
                || t instanceof TransientDataAccessException
                || t instanceof DataAccessResourceFailureException
                || t instanceof CannotCreateTransactionException
                || t instanceof RedisException) {
            return ErrorKind.TRANSIENT_CONNECTION;
        }
        return ErrorKind.INTERNAL;
    }

    /**
     * Translate into the engine's closed exception set, keeping the original as cause.
     */
    public static WorkflowException translate(Throwable t, String context) {
        if (t instanceof WorkflowException) {
            return (WorkflowException) t;
        }
        ErrorKind kind = classify(t);
        String message = context + ": " + t.getClass().getSimpleName();
        switch (kind) {
            case LOCK_ACQUISITION:
                return new LockAcquisitionException(message, t);
            case SERIALIZATION_CONFLICT:
                return new SerializationConflictException(message, t);
            case TRANSIENT_CONNECTION:
                return new TransientConnectionException(message, t);
            default:
                return new WorkflowInternalException(message, t);
        }
    }
}
