package com.fluxreader.core.workflow;

import java.util.List;

public record BatchSummary(int total, int completed, int failed, boolean cancelled, List<DownloadOutcome> outcomes) {

    public String message() {
        if (cancelled) {
            return String.format("Batch download cancelled. Downloaded %d/%d entries.", completed, total);
        }
        if (total == 0) {
            return "Nothing to download.";
        }
        if (failed == 0) {
            return total == 1 ? "Download completed successfully!"
                    : String.format("All %d entries downloaded successfully!", total);
        }
        if (completed == 0) {
            return total == 1 ? "Download failed."
                    : String.format("All %d entries failed to download.", total);
        }
        return String.format("Batch download completed: %d successful, %d failed.", completed, failed);
    }
}
