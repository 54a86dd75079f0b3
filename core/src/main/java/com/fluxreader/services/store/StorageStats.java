package com.fluxreader.services.store;

import com.fluxreader.common.util.FileUtils;

public record StorageStats(int entryCount, long totalBytes, int imageCount, long imageBytes) {

    @Override
    public String toString() {
        return entryCount + " entries, " + FileUtils.formatSize(totalBytes)
                + " (" + imageCount + " images, " + FileUtils.formatSize(imageBytes) + ")";
    }
}
