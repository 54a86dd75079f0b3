package com.fluxreader.services.sync;

public record StatusChangeResult(Outcome outcome, String message) {

    public enum Outcome {
        /** The server accepted the change. */
        SYNCED,
        /** Applied locally and queued for the next sync. */
        QUEUED,
        /** Applied locally, queued, and a background worker is sending it. */
        BACKGROUND,
        SKIPPED,
        INVALID
    }

    /**
     * True for every outcome the user should see as done.
     */
    public boolean isAccepted() {
        return outcome == Outcome.SYNCED || outcome == Outcome.QUEUED || outcome == Outcome.BACKGROUND;
    }
}
