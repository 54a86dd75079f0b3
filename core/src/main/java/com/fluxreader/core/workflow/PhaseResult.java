package com.fluxreader.core.workflow;

/**
 * How a phase (or a checkpoint inside it) ended.
 */
public enum PhaseResult {
    SUCCESS,
    CANCELLED,
    SKIP_IMAGES
}
