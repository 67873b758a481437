package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.LockAcquisitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.TransientConnectionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowException;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.InMemoryLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.StoreBackedDistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.support.WorkflowTestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.datasource.ConnectionHolder;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CriticalSectionExecutor")
class CriticalSectionExecutorTest {

    private WorkflowTestDatabase db;
    private InMemoryLockStore store;
    private CriticalSectionExecutor executor;

    @BeforeEach
    void setUp() {
        db = WorkflowTestDatabase.create();
        store = new InMemoryLockStore();
        executor = new CriticalSectionExecutor(
            new StoreBackedDistributedMutex(store, new WorkflowMetrics(), 1, 5),
            db.getTransactionManager(), new WorkflowMetrics(), 15000, 500);
    }

    @Test
    @DisplayName("Body runs in a transaction while the key is held, then the key is freed")
    void holdsLockAroundTransaction() {
        SectionTiming timing = new SectionTiming();

        Boolean inside = executor.execute("workflow:job:1", null, timing, status ->
            TransactionSynchronizationManager.isActualTransactionActive()
                && store.currentToken("workflow:job:1") != null);

        assertThat(inside).isTrue();
        assertThat(store.currentToken("workflow:job:1")).isNull();
        assertThat(timing.getTxDurationMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    @DisplayName("Key is freed after a failed body and the failure is translated")
    void releasesOnFailure() {
        assertThatThrownBy(() -> executor.execute("workflow:job:2", null, null, status -> {
            throw new QueryTimeoutException("statement timeout");
        })).isInstanceOfSatisfying(TransientConnectionException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.TRANSIENT_CONNECTION));

        assertThatThrownBy(() -> executor.execute("workflow:job:2", null, null, status -> {
            throw new IllegalStateException("bug");
        })).isInstanceOfSatisfying(WorkflowException.class,
            e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INTERNAL));

        assertThat(store.currentToken("workflow:job:2")).isNull();
    }

    @Test
    @DisplayName("Passed deadline fails before touching the lock")
    void passedDeadline() {
        assertThatThrownBy(() -> executor.execute("workflow:job:3", Instant.now().minusMillis(1), null,
            status -> "never"))
            .isInstanceOf(LockAcquisitionException.class);
    }

    @Test
    @DisplayName("Transaction timeout stays within the lock lease")
    void transactionTimeoutBoundedByTtl() {
        assertThat(executor.transactionTimeoutSeconds()).isEqualTo(15);
        CriticalSectionExecutor shortLease = new CriticalSectionExecutor(
            new StoreBackedDistributedMutex(store, null), db.getTransactionManager(), null, 1500, 0);
        assertThat(shortLease.transactionTimeoutSeconds()).isEqualTo(1);
        assertThatThrownBy(() -> new CriticalSectionExecutor(
            new StoreBackedDistributedMutex(store, null), db.getTransactionManager(), null, 999, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Database lock timeout becomes the transaction deadline of every statement")
    void databaseLockTimeoutBoundsStatements() {
        CriticalSectionExecutor bounded = new CriticalSectionExecutor(
            new StoreBackedDistributedMutex(store, null), db.getTransactionManager(), null, 15000, 500, 4000);
        DataSource dataSource = db.getTransactionManager().getDataSource();

        Integer secondsLeft = bounded.execute("workflow:job:4", null, null, status -> {
            ConnectionHolder holder = (ConnectionHolder) TransactionSynchronizationManager.getResource(dataSource);
            return holder.getTimeToLiveInSeconds();
        });

        assertThat(bounded.transactionTimeoutSeconds()).isEqualTo(4);
        assertThat(secondsLeft).isBetween(1, 4);
        assertThatThrownBy(() -> new CriticalSectionExecutor(
            new StoreBackedDistributedMutex(store, null), db.getTransactionManager(), null, 15000, 500, 20000))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("A caller's transaction is suspended, not joined")
    void callerTransactionIsSuspended() {
        DataSource dataSource = db.getTransactionManager().getDataSource();
        TransactionTemplate caller = new TransactionTemplate(db.getTransactionManager());

        Boolean separate = caller.execute(outer -> {
            Object callerHolder = TransactionSynchronizationManager.getResource(dataSource);
            Boolean inner = executor.execute("workflow:job:5", null, null, status ->
                status.isNewTransaction() && TransactionSynchronizationManager.getResource(dataSource) != callerHolder);
            outer.setRollbackOnly();
            return inner;
        });

        assertThat(separate).isTrue();
        assertThat(store.currentToken("workflow:job:5")).isNull();
    }
}
