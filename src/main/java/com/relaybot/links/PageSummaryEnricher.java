package com.relaybot.links;

import com.relaybot.observability.BotMetrics;
import io.micrometer.core.instrument.Timer;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PageSummaryEnricher implements LinkEnricher {

    private static final Logger log = LoggerFactory.getLogger(PageSummaryEnricher.class);

    static final String LABEL = "Page Info: ";
    static final String NO_TITLE = "No Title";
    static final String NO_DESCRIPTION = "No Description";

    private final PageFetcher fetcher;
    private final BotMetrics metrics;

    public PageSummaryEnricher(PageFetcher fetcher, BotMetrics metrics) {
        this.fetcher = fetcher;
        this.metrics = metrics;
    }

    @Override public String name() { return "page"; }

    @Override
    public boolean supports(String url) {
        return true;
    }

    @Override
    public EnrichmentResult enrich(String url) {
        log.debug("Fetching webpage description for URL: {}", url);
        var sample = Timer.start();
        try {
            var summary = summarize(fetcher.fetch(url));
            log.debug("Fetched webpage description: {}", summary);
            return EnrichmentResult.ok(LABEL + summary);
        } catch (Exception e) {
            log.warn("Error fetching webpage description for {}: {}", url, e.toString());
            return EnrichmentResult.skipped(url, e.toString());
        } finally {
            sample.stop(metrics.fetchLatency(name()));
        }
    }

    static String summarize(Document doc) {
        var titleTag = doc.selectFirst("title");
        var title = titleTag != null ? titleTag.text().strip() : "";
        if (title.isEmpty()) title = NO_TITLE;

        var meta = doc.selectFirst("meta[name=description]");
        var description = meta != null && meta.hasAttr("content") ? meta.attr("content").strip() : "";
        if (description.isEmpty()) description = NO_DESCRIPTION;

        return "Title: " + title + ", Description: " + description;
    }
}
