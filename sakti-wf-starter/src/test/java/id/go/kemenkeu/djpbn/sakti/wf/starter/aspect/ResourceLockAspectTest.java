package id.go.kemenkeu.djpbn.sakti.wf.starter.aspect;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.LockAcquisitionException;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.InMemoryLockStore;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockHandle;
import id.go.kemenkeu.djpbn.sakti.wf.core.lock.StoreBackedDistributedMutex;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.starter.annotation.ResourceLock;
import id.go.kemenkeu.djpbn.sakti.wf.starter.config.SaktiWfProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResourceLockAspect")
class ResourceLockAspectTest {

    private InMemoryLockStore store;
    private StoreBackedDistributedMutex mutex;
    private TicketActions proxy;

    public static class TicketActions {

        private final InMemoryLockStore store;

        public TicketActions(InMemoryLockStore store) {
            this.store = store;
        }

        @ResourceLock(key = "'ticket:' + #a0")
        public String heldToken(long ticketId) {
            return store.currentToken("workflow:ticket:" + ticketId);
        }

        @ResourceLock(key = "'ticket:' + #a0", blockingTimeoutMs = 50)
        public void quick(long ticketId) {
        }

        @ResourceLock(key = "'ticket:' + #a0")
        public void fail(long ticketId) {
            throw new IllegalStateException("boom");
        }
    }

    @BeforeEach
    void setUp() {
        store = new InMemoryLockStore();
        mutex = new StoreBackedDistributedMutex(store, new WorkflowMetrics(), 1, 5);
        AspectJProxyFactory factory = new AspectJProxyFactory(new TicketActions(store));
        factory.setProxyTargetClass(true);
        factory.addAspect(new ResourceLockAspect(mutex, new SaktiWfProperties()));
        proxy = factory.getProxy();
    }

    @Test
    @DisplayName("Method body runs while the prefixed key is held")
    void holdsKeyDuringCall() {
        assertThat(proxy.heldToken(7L)).isNotNull();
        assertThat(store.currentToken("workflow:ticket:7")).isNull();
    }

    @Test
    @DisplayName("Key is released when the method throws")
    void releasesOnException() {
        assertThatThrownBy(() -> proxy.fail(7L)).isInstanceOf(IllegalStateException.class);
        assertThat(store.currentToken("workflow:ticket:7")).isNull();
    }

    @Test
    @DisplayName("Busy key times out instead of running unlocked")
    void busyKeyTimesOut() {
        LockHandle held = mutex.acquire("workflow:ticket:9", 10000, 0);
        try {
            assertThatThrownBy(() -> proxy.quick(9L)).isInstanceOf(LockAcquisitionException.class);
        } finally {
            held.close();
        }
        proxy.quick(9L);
    }
}
