package id.go.kemenkeu.djpbn.sakti.wf.starter.metrics;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import jakarta.annotation.PostConstruct;

/**
 * Micrometer bridge for {@link WorkflowMetrics}.
 *
 * Metrics exposed:
 * - sakti_wf_transitions_total{outcome}    - applied / rejected / failed
 * - sakti_wf_failures_total{kind}          - failures by error kind
 * - sakti_wf_field_updates_total           - structured field writes
 * - sakti_wf_lock_total{result}            - acquired / timeout / stale_release
 * - sakti_wf_lock_wait_ms{stat}            - avg / max mutex wait
 * - sakti_wf_tx_duration_ms{stat}          - avg / max critical section
 * - sakti_wf_retries_total{result}         - retried / exhausted
 * - sakti_wf_audit_write_failures_total
 */
public class WorkflowMicrometerMetrics {

    private static final Logger log = LoggerFactory.getLogger(WorkflowMicrometerMetrics.class);

    private final MeterRegistry registry;
    private final WorkflowMetrics metrics;

    public WorkflowMicrometerMetrics(MeterRegistry registry, WorkflowMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("sakti_wf_transitions_total", metrics, WorkflowMetrics::getAppliedTransitions)
            .description("Workflow operations committed")
            .tag("outcome", "applied")
            .register(registry);
        Gauge.builder("sakti_wf_transitions_total", metrics, WorkflowMetrics::getRejectedTransitions)
            .description("Workflow operations refused by validation")
            .tag("outcome", "rejected")
            .register(registry);
        Gauge.builder("sakti_wf_transitions_total", metrics, WorkflowMetrics::getFailedTransitions)
            .description("Workflow operations rolled back")
            .tag("outcome", "failed")
            .register(registry);

        for (ErrorKind kind : ErrorKind.values()) {
            Gauge.builder("sakti_wf_failures_total", metrics, m -> m.getFailureCount(kind))
                .description("Failures by error kind")
                .tag("kind", kind.name().toLowerCase())
                .register(registry);
        }

        Gauge.builder("sakti_wf_field_updates_total", metrics, WorkflowMetrics::getFieldUpdates)
            .description("Structured field writes")
            .register(registry);

        Gauge.builder("sakti_wf_lock_total", metrics, WorkflowMetrics::getLockAcquisitions)
            .tag("result", "acquired")
            .register(registry);
        Gauge.builder("sakti_wf_lock_total", metrics, WorkflowMetrics::getLockTimeouts)
            .tag("result", "timeout")
            .register(registry);
        Gauge.builder("sakti_wf_lock_total", metrics, WorkflowMetrics::getStaleReleases)
            .tag("result", "stale_release")
            .register(registry);

        Gauge.builder("sakti_wf_lock_wait_ms", metrics, WorkflowMetrics::getAverageLockWaitMs)
            .tag("stat", "avg")
            .register(registry);
        Gauge.builder("sakti_wf_lock_wait_ms", metrics, WorkflowMetrics::getMaxLockWaitMs)
            .tag("stat", "max")
            .register(registry);
        Gauge.builder("sakti_wf_tx_duration_ms", metrics, WorkflowMetrics::getAverageTxDurationMs)
            .tag("stat", "avg")
            .register(registry);
        Gauge.builder("sakti_wf_tx_duration_ms", metrics, WorkflowMetrics::getMaxTxDurationMs)
            .tag("stat", "max")
            .register(registry);

        Gauge.builder("sakti_wf_retries_total", metrics, WorkflowMetrics::getRetries)
            .tag("result", "retried")
            .register(registry);
        Gauge.builder("sakti_wf_retries_total", metrics, WorkflowMetrics::getRetriesExhausted)
            .tag("result", "exhausted")
            .register(registry);

        Gauge.builder("sakti_wf_audit_write_failures_total", metrics, WorkflowMetrics::getAuditWriteFailures)
            .description("Audit entries that could not be written")
            .register(registry);

        log.info("SAKTI WF metrics registered to Micrometer");
    }
}
