package id.go.kemenkeu.djpbn.sakti.wf.core.statemachine;

import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;

import java.util.Map;

/**
 * Precondition attached to a target state, evaluated against the locked row
 * and the columns about to be written.
 */
@FunctionalInterface
public interface TransitionGuard<S extends Enum<S>> {

    boolean permits(S from, S to, ResourceRow current, Map<String, Object> pendingChanges);
}
