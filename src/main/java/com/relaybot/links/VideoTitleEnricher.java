package com.relaybot.links;

import com.relaybot.observability.BotMetrics;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class VideoTitleEnricher implements LinkEnricher {

    private static final Logger log = LoggerFactory.getLogger(VideoTitleEnricher.class);

    static final String WATCH_URL = "https://www.youtube.com/watch?v=";
    static final String LABEL = "YouTube Title: ";
    private static final String SITE_SUFFIX = "- YouTube";

    private final VideoIdExtractor idExtractor;
    private final PageFetcher fetcher;
    private final BotMetrics metrics;

    public VideoTitleEnricher(VideoIdExtractor idExtractor, PageFetcher fetcher, BotMetrics metrics) {
        this.idExtractor = idExtractor;
        this.fetcher = fetcher;
        this.metrics = metrics;
    }

    @Override public String name() { return "video"; }

    @Override
    public boolean supports(String url) {
        return url.contains("youtube.com") || url.contains("youtu.be");
    }

    @Override
    public EnrichmentResult enrich(String url) {
        log.debug("Extracting video ID from URL: {}", url);
        var videoId = idExtractor.extract(url);
        if (videoId.isEmpty()) {
            return EnrichmentResult.skipped(url, "no video id");
        }

        var id = videoId.get();
        log.debug("Fetching video title for ID: {}", id);
        var sample = Timer.start();
        try {
            var title = cleanTitle(fetcher.fetch(WATCH_URL + id).title());
            if (title.isEmpty()) {
                return EnrichmentResult.skipped(url, "video page has no title");
            }
            log.debug("Fetched video title: {}", title);
            return EnrichmentResult.ok(LABEL + title);
        } catch (Exception e) {
            log.warn("Error fetching video title for {}: {}", id, e.toString());
            return EnrichmentResult.skipped(url, e.toString());
        } finally {
            sample.stop(metrics.fetchLatency(name()));
        }
    }

    static String cleanTitle(String raw) {
        if (raw == null) return "";
        var title = raw.strip();
        if (title.endsWith(SITE_SUFFIX)) {
            title = title.substring(0, title.length() - SITE_SUFFIX.length());
        }
        return title.strip();
    }
}
