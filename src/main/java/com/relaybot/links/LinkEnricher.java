package com.relaybot.links;

public interface LinkEnricher {
    String name();
    boolean supports(String url);

    /** Never throws; failures come back as {@link EnrichmentResult.Skipped}. */
    EnrichmentResult enrich(String url);
}
