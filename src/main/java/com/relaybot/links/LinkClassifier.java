package com.relaybot.links;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

public class LinkClassifier {

    private static final Logger log = LoggerFactory.getLogger(LinkClassifier.class);

    private final List<LinkEnricher> enrichers;
    private final LinkEnricher fallback;

    public LinkClassifier(List<LinkEnricher> enrichers, LinkEnricher fallback) {
        this.enrichers = List.copyOf(enrichers);
        this.fallback = fallback;
    }

    public LinkEnricher classify(String url) {
        for (var enricher : enrichers) {
            if (enricher.supports(url)) return enricher;
        }
        return fallback;
    }

    public EnrichmentResult enrich(String url) {
        var enricher = classify(url);
        try {
            return enricher.enrich(url);
        } catch (RuntimeException e) {
            log.error("Enricher {} failed on {}", enricher.name(), url, e);
            return EnrichmentResult.skipped(url, enricher.name() + " failed: " + e);
        }
    }
}
