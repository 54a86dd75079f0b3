package com.fluxreader.core.workflow;

import java.util.function.LongSupplier;

/**
 * Lets a checkpoint through at most once per interval. An interval of zero lets every check through.
 */
public class CheckpointThrottle {
    private final long intervalMs;
    private final LongSupplier clock;
    private long last;

    public CheckpointThrottle(long intervalMs, LongSupplier clock) {
        this.intervalMs = intervalMs;
        this.clock = clock;
        this.last = clock.getAsLong();
    }

    public boolean due() {
        long now = clock.getAsLong();
        if (now - last >= intervalMs) {
            last = now;
            return true;
        }
        return false;
    }
}
