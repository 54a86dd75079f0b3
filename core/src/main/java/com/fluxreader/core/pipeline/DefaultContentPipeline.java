package com.fluxreader.core.pipeline;

import com.fluxreader.common.model.Entry;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public class DefaultContentPipeline implements ContentPipeline {
    private static final Logger logger = LoggerFactory.getLogger(DefaultContentPipeline.class);

    private final ImageFetcher fetcher;
    private final ImageDiscovery discovery;
    private final HtmlRewriter rewriter;

    public DefaultContentPipeline(ImageFetcher fetcher) {
        this(fetcher, new ImageDiscovery(), new HtmlRewriter());
    }

    public DefaultContentPipeline(ImageFetcher fetcher, ImageDiscovery discovery, HtmlRewriter rewriter) {
        this.fetcher = fetcher;
        this.discovery = discovery;
        this.rewriter = rewriter;
    }

    @Override
    public PreparedContent prepare(Entry entry) {
        Objects.requireNonNull(entry, "entry");
        String baseUrl = entry.getUrl() != null ? entry.getUrl().replace("&amp;", "&") : null;
        Document doc = Jsoup.parseBodyFragment(entry.getBestContent());
        Element body = doc.body();

        int videos = YouTubeEmbeds.replace(body);
        Map<String, ImageDescriptor> images = discovery.discover(body, baseUrl);
        logger.debug("Entry {}: {} images, {} video thumbnails", entry.getId(), images.size(), videos);
        return new PreparedContent(entry, body, baseUrl, images);
    }

    @Override
    public boolean materialize(ImageDescriptor image, Path entryDir, String entryUrl) {
        return fetcher.fetch(image, entryDir, entryUrl);
    }

    @Override
    public RenderedDocument render(PreparedContent prepared, File entryDir) {
        Element body = prepared.getBody();
        int rewritten = rewriter.rewriteImages(body, prepared.getImagesByUrl(), prepared.getBaseUrl());
        int stripped = rewriter.stripUnsupported(body);
        String html = rewriter.assembleDocument(prepared.getEntry(), body.html(), entryDir);
        return new RenderedDocument(html, prepared.imageMapping(), rewritten, stripped);
    }
}
