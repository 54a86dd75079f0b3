package com.fluxreader.core.pipeline;

import com.fluxreader.common.model.CategoryRef;
import com.fluxreader.common.model.Entry;
import com.fluxreader.common.model.FeedRef;
import com.fluxreader.test.TestBase;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the offline document rewriting
 */
class HtmlRewriterTest extends TestBase {

    private final HtmlRewriter rewriter = new HtmlRewriter();

    @Test
    void testRewrittenTagKeepsOnlyLocalSourceAndSize() {
        Element body = Jsoup.parseBodyFragment(
                "<img src=\"https://x.example/a.png\" class=\"hero\" loading=\"lazy\" srcset=\"a.png 2x\">").body();
        ImageDescriptor image = new ImageDescriptor("https://x.example/a.png", null, "image_001.png", 640, 480);

        rewriter.rewriteImages(body, Map.of("https://x.example/a.png", image), null);

        Element img = body.selectFirst("img");
        assertEquals("image_001.png", img.attr("src"));
        assertEquals("width: 640px; height: 480px", img.attr("style"));
        assertFalse(img.hasAttr("class"));
        assertFalse(img.hasAttr("srcset"));
    }

    @Test
    void testUnsupportedElementsAreStripped() {
        Element body = Jsoup.parseBodyFragment(
                "<p>text</p><script>alert(1)</script><form><input></form><video src=\"v.mp4\"></video>").body();

        int removed = rewriter.stripUnsupported(body);

        assertEquals(3, removed);
        assertEquals("<p>text</p>", body.html().trim());
    }

    @Test
    void testYouTubeIframeBecomesThumbnail() {
        Element body = Jsoup.parseBodyFragment(
                "<iframe src=\"https://www.youtube.com/embed/dQw4w9WgXcQ?rel=0\"></iframe>").body();

        assertEquals(1, YouTubeEmbeds.replace(body));

        Element img = body.selectFirst("p.youtube-thumbnail a img");
        assertNotNull(img);
        assertEquals("https://img.youtube.com/vi/dQw4w9WgXcQ/hqdefault.jpg", img.attr("src"));
        assertEquals("https://www.youtube.com/watch?v=dQw4w9WgXcQ", body.selectFirst("a").attr("href"));
        assertEquals(0, rewriter.stripUnsupported(body), "No iframe left to strip");
    }

    @Test
    void testVideoIdFormats() {
        assertEquals("dQw4w9WgXcQ", YouTubeEmbeds.videoId("https://youtu.be/dQw4w9WgXcQ"));
        assertEquals("dQw4w9WgXcQ", YouTubeEmbeds.videoId("https://www.youtube.com/watch?feature=share&v=dQw4w9WgXcQ"));
        assertEquals("dQw4w9WgXcQ", YouTubeEmbeds.videoId("https://www.youtube-nocookie.com/embed/dQw4w9WgXcQ"));
        assertNull(YouTubeEmbeds.videoId("https://vimeo.com/123"));
    }

    @Test
    void testDocumentHeader() {
        Entry entry = new Entry(7, "Tom & Jerry <live>");
        entry.setUrl("https://news.example.com/a?b=1");
        entry.setPublishedAt("2024-03-01T10:00:00Z");
        entry.setFeed(new FeedRef(3, "Cartoons", new CategoryRef(1, "Fun")));

        String html = rewriter.assembleDocument(entry, "<p>body</p>", new File("/tmp/miniflux/7"));

        assertTrue(html.contains("<title>Tom &amp; Jerry &lt;live&gt;</title>"), html);
        assertTrue(html.contains("<base href=\"file:///tmp/miniflux/7/\">"), html);
        assertTrue(html.contains("<strong>Feed:</strong> Cartoons"), html);
        assertTrue(html.contains("<strong>Published:</strong> 2024-03-01T10:00:00Z"), html);
        assertTrue(html.contains(">https://news.example.com</a>"), html);
        assertTrue(html.contains("<p>body</p>"));
    }

    @Test
    void testUntitledEntry() {
        String html = rewriter.assembleDocument(new Entry(8, null), "", null);

        assertTrue(html.contains("<h1>Untitled Entry</h1>"));
        assertFalse(html.contains("<base"));
    }
}
