package id.go.kemenkeu.djpbn.sakti.wf.starter.health;

import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockStore;
import id.go.kemenkeu.djpbn.sakti.wf.starter.config.SaktiWfProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pings the lock store and tracks consecutive failures as a circuit state.
 * The state is reported only: the engine never bypasses the mutex.
 */
public class LockStoreHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(LockStoreHealthIndicator.class);

    private final LockStore lockStore;
    private final SaktiWfProperties properties;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicLong lastFailureTime = new AtomicLong(0);
    private volatile CircuitState circuitState = CircuitState.CLOSED;

    public enum CircuitState {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    public LockStoreHealthIndicator(LockStore lockStore, SaktiWfProperties properties) {
        this.lockStore = lockStore;
        this.properties = properties;
    }

    @Override
    public Health health() {
        String store = lockStore.getClass().getSimpleName();
        refreshCircuit();

        boolean reachable;
        String error = null;
        try {
            reachable = lockStore.ping();
        } catch (RuntimeException e) {
            reachable = false;
            error = e.getMessage();
        }

        if (reachable) {
            consecutiveFailures.set(0);
            if (circuitState != CircuitState.CLOSED) {
                circuitState = CircuitState.CLOSED;
                log.info("Lock store {} recovered, circuit CLOSED", store);
            }
            return Health.up()
                .withDetail("store", store)
                .withDetail("circuitState", circuitState.name())
                .build();
        }

        handleFailure(store);
        Health.Builder down = Health.down()
            .withDetail("store", store)
            .withDetail("circuitState", circuitState.name())
            .withDetail("consecutiveFailures", consecutiveFailures.get());
        if (error != null) {
            down.withDetail("error", error);
        }
        return down.build();
    }

    private void handleFailure(String store) {
        int failures = consecutiveFailures.incrementAndGet();
        lastFailureTime.set(System.currentTimeMillis());
        int threshold = properties.getHealth().getFailureThreshold();
        if (failures >= threshold && circuitState != CircuitState.OPEN) {
            circuitState = CircuitState.OPEN;
            log.error("Lock store {} unreachable after {} checks, circuit OPEN", store, failures);
        } else {
            log.warn("Lock store {} health check failed ({}/{})", store, failures, threshold);
        }
    }

    private void refreshCircuit() {
        if (circuitState == CircuitState.OPEN
                && System.currentTimeMillis() - lastFailureTime.get() >= properties.getHealth().getRecoveryTimeoutMs()) {
            circuitState = CircuitState.HALF_OPEN;
            log.info("Lock store circuit HALF_OPEN, probing");
        }
    }

    public CircuitState getCircuitState() {
        return circuitState;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
