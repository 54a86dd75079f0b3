package com.fluxreader.services.navigation;

import com.fluxreader.core.workflow.DownloadOutcome;

public record NavigationResult(Status status, Long targetEntryId, Source source, DownloadOutcome outcome,
                               String message) {

    public enum Status { OPENED, NO_MORE_ENTRIES, FAILED, INVALID }

    public enum Source { SERVER, LOCAL_SCAN, LOCAL_LIST }

    public static NavigationResult opened(long target, Source source, DownloadOutcome outcome) {
        return new NavigationResult(outcome.isAvailable() ? Status.OPENED : Status.FAILED,
                target, source, outcome, outcome.message());
    }

    public static NavigationResult noMore(String message) {
        return new NavigationResult(Status.NO_MORE_ENTRIES, null, null, null, message);
    }

    public static NavigationResult failed(String message) {
        return new NavigationResult(Status.FAILED, null, null, null, message);
    }

    public static NavigationResult invalid(String message) {
        return new NavigationResult(Status.INVALID, null, null, null, message);
    }
}
