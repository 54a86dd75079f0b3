package com.fluxreader.core.config;

import java.io.File;

public class Configuration {
    // --- Server ---
    public String serverAddress = "";
    public String apiToken = "";
    public int apiTimeoutMs = 20000;

    // --- Listing ---
    public int limit = 100;
    public String order = "published_at";
    public String direction = "desc";
    public boolean hideReadEntries = true;

    // --- Reading ---
    public boolean includeImages = true;
    public boolean markAsReadOnOpen = true;
    public boolean autoDeleteReadOnClose = false;
    public int prefetchCount = 0;

    // Empty = <dataDir>/miniflux
    public String downloadDir = "";

    // --- Image download ---
    public boolean proxyImageDownloaderEnabled = false;
    public String proxyImageDownloaderUrl = "";
    public String proxyImageDownloaderToken = "";
    public int imageConnectTimeoutMs = 15000;
    public int imageReadTimeoutMs = 30000;

    // Minimum gap between cancellation checkpoints
    public long progressThrottleMs = 1000;

    public boolean isConfigured() {
        return serverAddress != null && !serverAddress.isBlank()
                && apiToken != null && !apiToken.isBlank();
    }

    public boolean isProxyActive() {
        return proxyImageDownloaderEnabled && proxyImageDownloaderUrl != null && !proxyImageDownloaderUrl.isBlank();
    }

    public File resolveDownloadDir(File dataDir) {
        if (downloadDir != null && !downloadDir.isBlank()) return new File(downloadDir);
        return new File(dataDir, "miniflux");
    }
}
