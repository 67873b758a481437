package id.go.kemenkeu.djpbn.sakti.wf.core.workflow;

import id.go.kemenkeu.djpbn.sakti.wf.core.record.ResourceRow;

public final class CoupledUpdateResult {

    private final ResourceRow parent;
    private final ResourceRow child;

    CoupledUpdateResult(ResourceRow parent, ResourceRow child) {
        this.parent = parent;
        this.child = child;
    }

    public ResourceRow getParent() {
        return parent;
    }

    public ResourceRow getChild() {
        return child;
    }
}
