package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffCalculator")
class BackoffCalculatorTest {

    private final RetryPolicy policy = new RetryPolicy(RetryPolicyName.DEFAULT, 5, 100, 2000,
        RetryPolicy.contentionAndTransient());

    @RepeatedTest(20)
    @DisplayName("Delay grows exponentially with bounded jitter")
    void exponentialWithJitter() {
        assertThat(BackoffCalculator.delayMs(policy, 0)).isBetween(100L, 200L);
        assertThat(BackoffCalculator.delayMs(policy, 1)).isBetween(200L, 300L);
        assertThat(BackoffCalculator.delayMs(policy, 2)).isBetween(400L, 500L);
    }

    @Test
    @DisplayName("Delay never exceeds the policy maximum")
    void cappedAtMax() {
        assertThat(BackoffCalculator.delayMs(policy, 10)).isEqualTo(2000L);
        assertThat(BackoffCalculator.delayMs(policy, 1000)).isEqualTo(2000L);
    }

    @Test
    @DisplayName("Negative retry index is rejected")
    void rejectsNegativeRetry() {
        assertThatThrownBy(() -> BackoffCalculator.delayMs(policy, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
