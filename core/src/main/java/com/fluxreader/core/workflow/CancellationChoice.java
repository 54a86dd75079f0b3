package com.fluxreader.core.workflow;

public enum CancellationChoice {
    /** Abandon the current entry and delete what was written for it. */
    CANCEL_ENTRY,
    /** Stop fetching images, keep the entry. */
    CONTINUE_WITHOUT_IMAGES,
    RESUME,
    CONTINUE,
    // batch only
    CANCEL_ALL_ENTRIES,
    SKIP_IMAGES_CURRENT,
    SKIP_IMAGES_ALL,
    INCLUDE_IMAGES_ALL
}
