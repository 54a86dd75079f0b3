package com.fluxreader.core.pipeline;

import org.jsoup.nodes.Element;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces YouTube players with a linked thumbnail.
 */
public final class YouTubeEmbeds {
    private static final Pattern VIDEO_ID = Pattern.compile(
            "(?:youtube(?:-nocookie)?\\.com/(?:embed/|v/|watch\\?(?:.*&)?v=)|youtu\\.be/)([A-Za-z0-9_-]{11})");

    private YouTubeEmbeds() {
    }

    /**
     * @return number of players replaced
     */
    public static int replace(Element body) {
        int replaced = 0;
        for (Element iframe : body.select("iframe[src*=youtu]")) {
            String videoId = videoId(iframe.attr("src"));
            if (videoId == null) continue;

            Element link = new Element("a").attr("href", "https://www.youtube.com/watch?v=" + videoId);
            link.appendElement("img")
                    .attr("src", "https://img.youtube.com/vi/" + videoId + "/hqdefault.jpg")
                    .attr("alt", "YouTube video");
            Element wrapper = new Element("p").addClass("youtube-thumbnail").appendChild(link);
            iframe.replaceWith(wrapper);
            replaced++;
        }
        return replaced;
    }

    static String videoId(String url) {
        if (url == null) return null;
        Matcher m = VIDEO_ID.matcher(url);
        return m.find() ? m.group(1) : null;
    }
}
