package com.fluxreader.core.pipeline;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Finds the images of an entry body, resolves their URLs and assigns local file names.
 */
public class ImageDiscovery {
    private static final Logger logger = LoggerFactory.getLogger(ImageDiscovery.class);
    private static final Set<String> EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "svg");

    /**
     * @return descriptors keyed by normalized absolute URL, in discovery order
     */
    public Map<String, ImageDescriptor> discover(Element body, String baseUrl) {
        Map<String, ImageDescriptor> seen = new LinkedHashMap<>();
        int count = 0;
        for (Element img : body.select("img")) {
            String src = img.attr("src").trim();
            if (src.isEmpty() || isDataUri(src)) continue;

            String normalized = normalizeUrl(src, baseUrl);
            if (seen.containsKey(normalized)) continue;

            count++;
            String filename = String.format("image_%03d.%s", count, extensionOf(normalized));
            String highRes = highResCandidate(img.attr("srcset"), baseUrl);
            seen.put(normalized, new ImageDescriptor(normalized, highRes, filename,
                    parseDimension(img.attr("width")), parseDimension(img.attr("height"))));
        }
        logger.debug("Discovered {} unique images", seen.size());
        return seen;
    }

    static boolean isDataUri(String src) {
        return src.regionMatches(true, 0, "data:", 0, 5);
    }

    /**
     * Protocol-relative URLs get https, relative ones are resolved against the entry URL.
     */
    public static String normalizeUrl(String src, String baseUrl) {
        if (src.startsWith("//")) return "https:" + src;
        String lower = src.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return src;
        if (baseUrl == null || baseUrl.isBlank()) return src;
        try {
            return new URL(new URL(baseUrl), src).toExternalForm();
        } catch (MalformedURLException e) {
            logger.debug("Cannot resolve {} against {}: {}", src, baseUrl, e.getMessage());
            return src;
        }
    }

    static String extensionOf(String url) {
        String path = url;
        int cut = indexOfAny(path, '?', '#');
        if (cut >= 0) path = path.substring(0, cut);
        int slash = path.lastIndexOf('/');
        String name = slash >= 0 ? path.substring(slash + 1) : path;
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) return "jpg";
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return EXTENSIONS.contains(ext) ? ext : "jpg";
    }

    /**
     * Picks the {@code 2x} candidate of a srcset attribute.
     */
    static String highResCandidate(String srcset, String baseUrl) {
        if (srcset == null || srcset.isBlank()) return null;
        for (String candidate : srcset.split(",")) {
            String[] parts = candidate.trim().split("\\s+");
            if (parts.length == 2 && parts[1].equals("2x") && !isDataUri(parts[0])) {
                return normalizeUrl(parts[0], baseUrl);
            }
        }
        return null;
    }

    private static Integer parseDimension(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            int parsed = Integer.parseInt(value.trim().replace("px", ""));
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
