package com.fluxreader.core.workflow;

/**
 * Decisions shared by every entry of one batch run, so the user is asked once.
 */
public class BatchState {
    private final int totalEntries;
    private int currentIndex;
    private boolean skipImagesForAll;
    private boolean cancelAll;

    public BatchState(int totalEntries) {
        this.totalEntries = totalEntries;
    }

    public int getTotalEntries() {
        return totalEntries;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    void moveTo(int index) {
        this.currentIndex = index;
    }

    public boolean isSkipImagesForAll() {
        return skipImagesForAll;
    }

    public void setSkipImagesForAll(boolean skipImagesForAll) {
        this.skipImagesForAll = skipImagesForAll;
    }

    public boolean isCancelAll() {
        return cancelAll;
    }

    public void cancelAll() {
        this.cancelAll = true;
    }
}
