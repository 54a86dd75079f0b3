package com.fluxreader.core.workflow;

public enum DownloadPhase {
    IDLE,
    PREPARING,
    DOWNLOADING,
    PROCESSING,
    COMPLETING
}
