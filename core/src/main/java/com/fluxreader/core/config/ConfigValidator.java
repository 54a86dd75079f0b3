package com.fluxreader.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Checks the configuration on startup so misconfiguration shows up before the first request.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    private static final Set<String> ORDERS = Set.of("id", "status", "published_at", "category_title", "category_id");
    private static final Set<String> DIRECTIONS = Set.of("asc", "desc");

    public enum Severity { ERROR, WARNING }

    public record ValidationError(String message, Severity severity) {
        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    private final File dataDir;

    public ConfigValidator(File dataDir) {
        this.dataDir = dataDir;
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();
        validateServer(config, errors);
        validateListing(config, errors);
        validateProxy(config, errors);
        validateDownloadDir(config, errors);
        return errors;
    }

    private void validateServer(Configuration config, List<ValidationError> errors) {
        if (config.serverAddress == null || config.serverAddress.isBlank()) {
            errors.add(new ValidationError("No server address configured - online features disabled", Severity.ERROR));
        } else if (!isHttpUrl(config.serverAddress)) {
            errors.add(new ValidationError("Server address is not an http(s) URL: " + config.serverAddress, Severity.ERROR));
        }
        if (config.apiToken == null || config.apiToken.isBlank()) {
            errors.add(new ValidationError("No API token configured - requests will be rejected", Severity.ERROR));
        }
    }

    private void validateListing(Configuration config, List<ValidationError> errors) {
        if (config.limit < 1 || config.limit > 1000) {
            errors.add(new ValidationError("Entry limit must be between 1 and 1000, got " + config.limit, Severity.WARNING));
        }
        if (config.order == null || !ORDERS.contains(config.order)) {
            errors.add(new ValidationError("Unknown sort order: " + config.order, Severity.WARNING));
        }
        if (config.direction == null || !DIRECTIONS.contains(config.direction)) {
            errors.add(new ValidationError("Unknown sort direction: " + config.direction, Severity.WARNING));
        }
        if (config.prefetchCount < 0) {
            errors.add(new ValidationError("Prefetch count cannot be negative", Severity.WARNING));
        }
    }

    private void validateProxy(Configuration config, List<ValidationError> errors) {
        if (!config.proxyImageDownloaderEnabled) return;
        if (config.proxyImageDownloaderUrl == null || config.proxyImageDownloaderUrl.isBlank()) {
            errors.add(new ValidationError("Image proxy enabled but no proxy URL set - images load directly", Severity.WARNING));
        } else if (!isHttpUrl(config.proxyImageDownloaderUrl)) {
            errors.add(new ValidationError("Image proxy URL is not an http(s) URL", Severity.ERROR));
        }
    }

    private void validateDownloadDir(Configuration config, List<ValidationError> errors) {
        File dir = config.resolveDownloadDir(dataDir);
        if (!dir.exists()) {
            if (!dir.mkdirs()) {
                errors.add(new ValidationError("Cannot create download directory: " + dir.getAbsolutePath(), Severity.ERROR));
            } else {
                logger.info("Created download directory: {}", dir.getAbsolutePath());
            }
        } else if (!dir.isDirectory()) {
            errors.add(new ValidationError("Download path is not a directory: " + dir.getAbsolutePath(), Severity.ERROR));
        }
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Logs every finding.
     *
     * @return the number of ERROR findings
     */
    public int validateAndReport(Configuration config) {
        int errorCount = 0;
        int warningCount = 0;
        for (ValidationError error : validate(config)) {
            if (error.severity() == Severity.ERROR) {
                logger.error("Config error: {}", error.message());
                errorCount++;
            } else {
                logger.warn("Config warning: {}", error.message());
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("Configuration validation passed");
        }
        return errorCount;
    }
}
