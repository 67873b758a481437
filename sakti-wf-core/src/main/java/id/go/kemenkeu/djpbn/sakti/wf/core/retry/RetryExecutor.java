package id.go.kemenkeu.djpbn.sakti.wf.core.retry;

import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorClassifier;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ErrorKind;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.ServiceUnavailableException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowException;
import id.go.kemenkeu.djpbn.sakti.wf.core.exception.WorkflowInternalException;
import id.go.kemenkeu.djpbn.sakti.wf.core.metrics.WorkflowMetrics;
import id.go.kemenkeu.djpbn.sakti.wf.core.wrapper.CheckedSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Runs an operation under a {@link RetryPolicy}.
 *
 * <p>Only failures whose {@link ErrorKind} is in the policy's retryable set are
 * retried. Everything else propagates on the first occurrence. When attempts
 * or the caller deadline run out the last failure is wrapped in
 * {@link ServiceUnavailableException}.</p>
 *
 * <p>The caller's policy decides what is retryable. Once a failure is in the
 * infrastructure category (lock store or database unreachable) the attempt
 * budget and backoff come from {@link RetryPolicyName#INFRASTRUCTURE}.</p>
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final RetryPolicies policies;
    private final WorkflowMetrics metrics;
    private final Sleeper sleeper;

    public RetryExecutor(RetryPolicies policies, WorkflowMetrics metrics) {
        this(policies, metrics, Sleeper.THREAD);
    }

    public RetryExecutor(RetryPolicies policies, WorkflowMetrics metrics, Sleeper sleeper) {
        this.policies = policies != null ? policies : RetryPolicies.defaults();
        this.metrics = metrics != null ? metrics : new WorkflowMetrics();
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
    }

    public RetryPolicy policy(RetryPolicyName name) {
        return policies.get(name);
    }

    public <T> T execute(String operation, RetryPolicyName policyName, String correlationId,
                         CheckedSupplier<T> action) {
        return execute(operation, policies.get(policyName), correlationId, null, action);
    }

    public <T> T execute(String operation, RetryPolicy policy, String correlationId,
                         Instant deadline, CheckedSupplier<T> action) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.get();
            } catch (Exception e) {
                ErrorKind kind = ErrorClassifier.classify(e);

                if (!policy.isRetryable(kind)) {
                    throw propagate(e, correlationId);
                }

                RetryPolicy budget = budgetFor(policy, kind);
                if (attempt >= budget.getMaxAttempts()) {
                    metrics.recordRetriesExhausted();
                    log.error("{} exhausted {} attempt(s) under {} - last failure: {}",
                        operation, attempt, budget.getName(), kind);
                    throw new ServiceUnavailableException(operation, attempt, correlationId, e);
                }

                long delay = BackoffCalculator.delayMs(budget, attempt - 1);
                if (deadline != null && Instant.now().plusMillis(delay).isAfter(deadline)) {
                    metrics.recordRetriesExhausted();
                    log.warn("{} stopped after {} attempt(s): caller deadline {} reached",
                        operation, attempt, deadline);
                    throw new ServiceUnavailableException(operation, attempt, correlationId, e);
                }

                metrics.recordRetry(kind);
                log.warn("{} attempt {}/{} failed with {} - retrying in {}ms",
                    operation, attempt, budget.getMaxAttempts(), kind, delay);

                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ServiceUnavailableException(operation, attempt, correlationId, e);
                }
            }
        }
    }

    private RetryPolicy budgetFor(RetryPolicy policy, ErrorKind kind) {
        if (kind.getCategory() == ErrorKind.Category.INFRASTRUCTURE
            && policy.getName() != RetryPolicyName.INFRASTRUCTURE) {
            return policies.get(RetryPolicyName.INFRASTRUCTURE);
        }
        return policy;
    }

    private static RuntimeException propagate(Exception e, String correlationId) {
        if (e instanceof WorkflowException) {
            return ((WorkflowException) e).withCorrelationId(correlationId);
        }
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new WorkflowInternalException("Checked failure: " + e.getClass().getSimpleName(), e)
            .withCorrelationId(correlationId);
    }
}
