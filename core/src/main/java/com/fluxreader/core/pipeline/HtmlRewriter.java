package com.fluxreader.core.pipeline;

import com.fluxreader.common.model.Entry;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Entities;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns an entry body into a self-contained offline document.
 */
public class HtmlRewriter {
    private static final String UNSUPPORTED = "script, iframe, video, object, embed, form, style";
    private static final Pattern URL_HOST = Pattern.compile("^(https?://[^/]+)");

    /**
     * Points every discovered image at its local file. Images that were not
     * discovered (data URIs, empty sources) are left untouched.
     *
     * @return number of tags rewritten
     */
    public int rewriteImages(Element body, Map<String, ImageDescriptor> images, String baseUrl) {
        int rewritten = 0;
        for (Element img : body.select("img")) {
            String src = img.attr("src").trim();
            if (src.isEmpty() || ImageDiscovery.isDataUri(src)) continue;

            ImageDescriptor image = images.get(ImageDiscovery.normalizeUrl(src, baseUrl));
            if (image == null) continue;

            img.clearAttributes();
            img.attr("src", image.getFilename());
            String style = styleFor(image);
            if (!style.isEmpty()) img.attr("style", style);
            img.attr("alt", "");
            rewritten++;
        }
        return rewritten;
    }

    private static String styleFor(ImageDescriptor image) {
        List<String> props = new ArrayList<>(2);
        if (image.getWidth() != null) props.add("width: " + image.getWidth() + "px");
        if (image.getHeight() != null) props.add("height: " + image.getHeight() + "px");
        return String.join("; ", props);
    }

    /**
     * Removes elements that cannot work offline.
     *
     * @return number of elements removed
     */
    public int stripUnsupported(Element body) {
        int removed = 0;
        for (Element element : body.select(UNSUPPORTED)) {
            if (element.parent() == null) continue; // already gone with an ancestor
            element.remove();
            removed++;
        }
        return removed;
    }

    public String assembleDocument(Entry entry, String bodyHtml, File entryDir) {
        String title = Entities.escape(entry.getDisplayTitle());
        StringBuilder meta = new StringBuilder();
        if (entry.getFeed() != null && entry.getFeed().title() != null) {
            meta.append("\n        <p><strong>Feed:</strong> ").append(Entities.escape(entry.getFeed().title())).append("</p>");
        }
        if (entry.getPublishedAt() != null) {
            meta.append("\n        <p><strong>Published:</strong> ").append(Entities.escape(entry.getPublishedAt())).append("</p>");
        }
        if (entry.getUrl() != null && !entry.getUrl().isBlank()) {
            String url = entry.getUrl();
            Matcher m = URL_HOST.matcher(url);
            String shown = m.find() ? m.group(1) : url;
            meta.append("\n        <p><strong>URL:</strong> <a href=\"").append(escapeAttribute(url)).append("\">")
                    .append(Entities.escape(shown)).append("</a></p>");
        }

        String base = entryDir != null
                ? "\n    <base href=\"" + escapeAttribute(toFileUrl(entryDir)) + "\">"
                : "";

        return """
                <!DOCTYPE html>
                <html lang="en">
                <head>
                    <meta charset="UTF-8">
                    <meta name="viewport" content="width=device-width, initial-scale=1.0">
                    <title>%s</title>%s
                </head>
                <body>
                    <div class="entry-meta">
                        <h1>%s</h1>%s
                    </div>
                    <div class="entry-content">
                %s
                    </div>
                </body>
                </html>
                """.formatted(title, base, title, meta, bodyHtml);
    }

    private static String escapeAttribute(String value) {
        return Entities.escape(value).replace("\"", "&quot;");
    }

    /**
     * {@code file:///abs/path/} with forward slashes and a trailing slash.
     */
    static String toFileUrl(File dir) {
        String path = dir.getAbsolutePath().replace('\\', '/');
        while (path.endsWith("/") && path.length() > 1) path = path.substring(0, path.length() - 1);
        return path.startsWith("/") ? "file://" + path + "/" : "file:///" + path + "/";
    }
}
