package com.fluxreader.services.sync;

import java.util.List;

/**
 * Aggregate outcome of one reconciliation run.
 *
 * @param failedQueues names of queues that could not be cleared (discard only)
 */
public record SyncReport(Outcome outcome, int processed, int failed, List<String> failedQueues) {

    public enum Outcome {
        NOTHING_TO_SYNC,
        DEFERRED,
        SYNCED,
        DISCARDED,
        DISCARD_FAILED
    }

    public static SyncReport of(Outcome outcome) {
        return new SyncReport(outcome, 0, 0, List.of());
    }

    public static SyncReport synced(int processed, int failed) {
        return new SyncReport(Outcome.SYNCED, processed, failed, List.of());
    }

    public String message() {
        switch (outcome) {
            case NOTHING_TO_SYNC:
                return "All changes are already synced";
            case DEFERRED:
                return "Sync postponed";
            case DISCARDED:
                return "All sync queues cleared";
            case DISCARD_FAILED:
                return "Failed to clear queues: " + String.join(", ", failedQueues);
            default:
                break;
        }
        if (processed > 0) {
            String message = processed == 1 ? "1 change synced" : String.format("%d changes synced", processed);
            return failed > 0 ? message + String.format(", %d failed", failed) : message;
        }
        if (failed > 0) {
            return failed == 1 ? "1 change failed to sync" : String.format("%d changes failed to sync", failed);
        }
        return "All changes are already synced";
    }
}
