package id.go.kemenkeu.djpbn.sakti.wf.core.context;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Binds a correlation id to the current thread's MDC for the duration of one
 * engine operation, so every log line, audit row and surfaced error share it.
 *
 * <pre>
 * try (CorrelationContext ctx = CorrelationContext.open(request.getCorrelationId())) {
 *     ...
 * }
 * </pre>
 */
public final class CorrelationContext implements AutoCloseable {

    public static final String MDC_KEY = "correlationId";

    private final String correlationId;
    private final String previous;

    private CorrelationContext(String correlationId, String previous) {
        this.correlationId = correlationId;
        this.previous = previous;
    }

    /**
     * Open a scope. A blank id is replaced by a fresh one; an id already bound
     * by an enclosing scope is reused when none is given.
     */
    public static CorrelationContext open(String correlationId) {
        String previous = MDC.get(MDC_KEY);
        String id = correlationId;
        if (id == null || id.isBlank()) {
            id = previous != null ? previous : newId();
        }
        MDC.put(MDC_KEY, id);
        return new CorrelationContext(id, previous);
    }

    public static String current() {
        return MDC.get(MDC_KEY);
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    public void close() {
        if (previous == null) {
            MDC.remove(MDC_KEY);
        } else {
            MDC.put(MDC_KEY, previous);
        }
    }
}
