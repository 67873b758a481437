package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;

/**
 * Hook run inside the critical section after the row write and before
 * commit. Throwing rolls the whole operation back.
 */
@FunctionalInterface
public interface TransitionListener {

    void beforeCommit(String operation, ResourceRow before, ResourceRow after);
}
