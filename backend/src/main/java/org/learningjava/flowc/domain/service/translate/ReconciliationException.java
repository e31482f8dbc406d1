package org.learningjava.flowc.domain.service.translate;

/**
 * Raised when reconciled output still has a non-zero block depth. That is a defect in the
 * reconciler, never a problem with the Flow input.
 */
public class ReconciliationException extends IllegalStateException {

    private final int depth;

    public ReconciliationException(int depth) {
        super("Block reconciliation left depth " + depth + " instead of 0");
        this.depth = depth;
    }

    public int depth() {
        return depth;
    }
}
