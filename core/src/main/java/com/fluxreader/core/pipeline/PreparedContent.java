package com.fluxreader.core.pipeline;

import com.fluxreader.common.model.Entry;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed entry body with its discovered images, ready to be materialized and rendered.
 */
public class PreparedContent {
    private final Entry entry;
    private final Element body;
    private final String baseUrl;
    private final Map<String, ImageDescriptor> imagesByUrl;

    public PreparedContent(Entry entry, Element body, String baseUrl, Map<String, ImageDescriptor> imagesByUrl) {
        this.entry = entry;
        this.body = body;
        this.baseUrl = baseUrl;
        this.imagesByUrl = imagesByUrl;
    }

    public Entry getEntry() {
        return entry;
    }

    public Element getBody() {
        return body;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Map<String, ImageDescriptor> getImagesByUrl() {
        return imagesByUrl;
    }

    public List<ImageDescriptor> getImages() {
        return new ArrayList<>(imagesByUrl.values());
    }

    /**
     * Local file name to source URL, for every discovered image whether or not it was fetched.
     */
    public Map<String, String> imageMapping() {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (ImageDescriptor image : imagesByUrl.values()) {
            mapping.put(image.getFilename(), image.getSourceUrl());
        }
        return mapping;
    }

    public int downloadedCount() {
        int count = 0;
        for (ImageDescriptor image : imagesByUrl.values()) {
            if (image.isDownloaded()) count++;
        }
        return count;
    }
}
