package com.fluxreader.core.pipeline;

import java.util.List;

/**
 * Human readable image outcome of one entry download.
 */
public final class DownloadSummary {

    private DownloadSummary() {
    }

    public static String describe(boolean includeImages, List<ImageDescriptor> images) {
        int total = images.size();
        if (!includeImages) {
            return total + " images found (skipped - disabled in settings)";
        }
        if (total == 0) {
            return "No images found in entry";
        }
        long downloaded = images.stream().filter(ImageDescriptor::isDownloaded).count();
        if (downloaded == total) return "All images downloaded successfully";
        if (downloaded > 0) return downloaded + " of " + total + " images downloaded";
        return "No images could be downloaded";
    }
}
