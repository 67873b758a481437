package id.go.kemenkeu.djpbn.sakti.wf.starter.health;

import id.go.kemenkeu.djpbn.sakti.wf.core.lock.LockStore;
import id.go.kemenkeu.djpbn.sakti.wf.starter.config.SaktiWfProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("LockStoreHealthIndicator")
class LockStoreHealthIndicatorTest {

    @Mock
    private LockStore lockStore;

    private SaktiWfProperties properties;
    private LockStoreHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        properties = new SaktiWfProperties();
        properties.getHealth().setFailureThreshold(2);
        properties.getHealth().setRecoveryTimeoutMs(0);
        indicator = new LockStoreHealthIndicator(lockStore, properties);
    }

    @Test
    @DisplayName("Reachable store is UP with a closed circuit")
    void up() {
        when(lockStore.ping()).thenReturn(true);

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("circuitState", "CLOSED");
    }

    @Test
    @DisplayName("Circuit opens after the failure threshold and closes on recovery")
    void opensAndRecovers() {
        when(lockStore.ping()).thenReturn(false, false, true);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.DOWN);
        Health second = indicator.health();
        assertThat(second.getStatus()).isEqualTo(Status.DOWN);
        assertThat(indicator.getCircuitState()).isEqualTo(LockStoreHealthIndicator.CircuitState.OPEN);
        assertThat(second.getDetails()).containsEntry("consecutiveFailures", 2);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UP);
        assertThat(indicator.getCircuitState()).isEqualTo(LockStoreHealthIndicator.CircuitState.CLOSED);
        assertThat(indicator.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Ping exceptions are reported as DOWN with the error")
    void pingThrows() {
        when(lockStore.ping()).thenThrow(new IllegalStateException("connection refused"));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("error", "connection refused");
    }
}
