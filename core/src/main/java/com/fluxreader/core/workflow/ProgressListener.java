package com.fluxreader.core.workflow;

@FunctionalInterface
public interface ProgressListener {

    void onProgress(DownloadPhase phase, String message);

    ProgressListener NONE = (phase, message) -> { };
}
