package com.fluxreader.core.pipeline;

import java.util.Map;

/**
 * Final offline HTML plus the file name to source URL map that goes into the metadata.
 */
public record RenderedDocument(String html, Map<String, String> images, int rewrittenTags, int strippedElements) {
}
