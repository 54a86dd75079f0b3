package com.fluxreader.core.pipeline;

import com.fluxreader.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * HTTP {@link ImageFetcher} with size, type and length sanity checks.
 */
public class ImageDownloader implements ImageFetcher {
    private static final Logger logger = LoggerFactory.getLogger(ImageDownloader.class);

    public static final long MIN_BYTES = 10;
    public static final long DEFAULT_MAX_BYTES = 50L * 1024 * 1024;

    private static final String USER_AGENT = "FluxReader/1.0 (Offline Reader)";
    private static final String MOBILE_BROWSER_UA = "Mozilla/5.0 (Linux; Android 10; Mobile) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/91.0.4472.120 Mobile Safari/537.36";
    private static final String REDDIT_REFERER = "https://www.reddit.com/";

    private final Configuration config;
    private final long maxBytes;

    public ImageDownloader(Configuration config) {
        this(config, DEFAULT_MAX_BYTES);
    }

    public ImageDownloader(Configuration config, long maxBytes) {
        this.config = config;
        this.maxBytes = maxBytes;
    }

    @Override
    public boolean fetch(ImageDescriptor image, Path entryDir, String entryUrl) {
        Path target = entryDir.resolve(image.getFilename());
        String url = requestUrl(image.getDownloadUrl());
        String failure = download(url, target, entryUrl);
        if (failure == null) {
            image.markDownloaded();
            logger.debug("Image OK {} <- {}", image.getFilename(), image.getDownloadUrl());
            return true;
        }
        deleteQuietly(target);
        image.markFailed(failure);
        logger.debug("Image FAIL {} ({}) <- {}", image.getFilename(), failure, image.getDownloadUrl());
        return false;
    }

    /**
     * Decodes {@code &amp;} and routes the URL through the image proxy when one is configured.
     */
    String requestUrl(String imageUrl) {
        String url = imageUrl.replace("&amp;", "&");
        if (config.isProxyActive()) {
            url = config.proxyImageDownloaderUrl + URLEncoder.encode(url, StandardCharsets.UTF_8);
        }
        return url;
    }

    static boolean needsBrowserHeaders(String url) {
        return url.contains("redd.it") || url.contains("reddit.com");
    }

    static String refererFor(String entryUrl) {
        String referer = entryUrl == null || entryUrl.isBlank() ? REDDIT_REFERER : entryUrl.replace("&amp;", "&");
        int q = referer.indexOf('?');
        return q > 0 ? referer.substring(0, q) : referer;
    }

    /**
     * @return null on success, otherwise the reason the image was rejected
     */
    private String download(String url, Path target, String entryUrl) {
        HttpURLConnection conn = null;
        try {
            conn = (HttpURLConnection) URI.create(url).toURL().openConnection();
            conn.setRequestMethod("GET");
            conn.setRequestProperty("User-Agent", USER_AGENT);

            if (config.isProxyActive() && config.proxyImageDownloaderToken != null
                    && !config.proxyImageDownloaderToken.isBlank()) {
                conn.setRequestProperty("Authorization", "Bearer " + config.proxyImageDownloaderToken);
            }
            // Reddit answers 403 without a browser-like Referer/User-Agent
            if (needsBrowserHeaders(url)) {
                conn.setRequestProperty("Referer", refererFor(entryUrl));
                conn.setRequestProperty("User-Agent", MOBILE_BROWSER_UA);
            }

            conn.setConnectTimeout(config.imageConnectTimeoutMs);
            conn.setReadTimeout(config.imageReadTimeoutMs);
            conn.setInstanceFollowRedirects(true);

            int status = conn.getResponseCode();
            if (status != 200) {
                return "HTTP " + status;
            }

            String contentType = conn.getContentType();
            if (contentType != null) {
                String type = contentType.toLowerCase(Locale.ROOT);
                if (!type.contains("image/") && !type.contains("application/octet-stream")) {
                    return "content type " + type;
                }
            }

            long written;
            try (InputStream in = conn.getInputStream();
                 OutputStream out = Files.newOutputStream(target)) {
                written = copyBounded(in, out);
            }
            if (written < 0) {
                return "larger than " + maxBytes + " bytes";
            }
            if (written < MIN_BYTES) {
                return "too small (" + written + " bytes)";
            }
            long expected = conn.getContentLengthLong();
            if (expected >= 0 && expected != written) {
                return "incomplete (" + written + " of " + expected + " bytes)";
            }
            return null;
        } catch (IOException | IllegalArgumentException e) {
            return e.getClass().getSimpleName() + ": " + e.getMessage();
        } finally {
            if (conn != null) conn.disconnect();
        }
    }

    /**
     * @return bytes copied, or -1 once the limit is exceeded
     */
    private long copyBounded(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[16 * 1024];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            total += read;
            if (total > maxBytes) return -1;
            out.write(buffer, 0, read);
        }
        return total;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.warn("Could not remove rejected image {}: {}", file, e.getMessage());
        }
    }
}
