package com.fluxreader.core.workflow;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set by the UI thread, observed by the workflow at its checkpoints only.
 */
public class CancellationToken {
    private final AtomicBoolean requested = new AtomicBoolean(false);

    public void requestCancel() {
        requested.set(true);
    }

    /**
     * Reads and clears the request in one step.
     */
    public boolean consume() {
        return requested.getAndSet(false);
    }
}
