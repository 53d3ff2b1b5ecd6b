package com.relaybot.links;

import com.relaybot.observability.BotMetrics;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class PageSummaryEnricherTest {

    private final PageFetcher fetcher = mock(PageFetcher.class);
    private final BotMetrics metrics = new BotMetrics();
    private final PageSummaryEnricher enricher = new PageSummaryEnricher(fetcher, metrics);

    @Test
    void combinesTitleAndDescription() throws Exception {
        when(fetcher.fetch("https://example.com")).thenReturn(Jsoup.parse("""
                <html><head>
                  <title> Example Domain </title>
                  <meta name="description" content=" An illustrative page. ">
                </head></html>
                """));

        var result = enricher.enrich("https://example.com");

        assertEquals(Optional.of("Page Info: Title: Example Domain, Description: An illustrative page."),
                result.reply());
    }

    @Test
    void fallsBackWhenTitleAndDescriptionMissing() throws Exception {
        when(fetcher.fetch(anyString())).thenReturn(Jsoup.parse("<html><body>hi</body></html>"));

        var result = enricher.enrich("https://bare.example");

        assertEquals(Optional.of("Page Info: Title: No Title, Description: No Description"), result.reply());
    }

    @Test
    void metaWithoutContentCountsAsMissing() throws Exception {
        when(fetcher.fetch(anyString())).thenReturn(Jsoup.parse(
                "<title>T</title><meta name=\"description\">"));

        assertEquals(Optional.of("Page Info: Title: T, Description: No Description"),
                enricher.enrich("https://x.example").reply());
    }

    @Test
    void ignoresOtherMetaTags() throws Exception {
        when(fetcher.fetch(anyString())).thenReturn(Jsoup.parse(
                "<title>T</title><meta name=\"keywords\" content=\"a,b\"><meta property=\"og:description\" content=\"og\">"));

        assertEquals(Optional.of("Page Info: Title: T, Description: No Description"),
                enricher.enrich("https://x.example").reply());
    }

    @Test
    void failureIsSkippedAndTimed() throws Exception {
        when(fetcher.fetch(anyString())).thenThrow(new UnsupportedMimeTypeException("binary", "image/png", "u"));

        var result = enricher.enrich("https://x.example/cat.png");

        assertInstanceOf(EnrichmentResult.Skipped.class, result);
        assertEquals(1, metrics.fetchLatency("page").count());
    }

    @Test
    void malformedUrlIsSkipped() throws Exception {
        when(fetcher.fetch("httpnotaurl")).thenThrow(new IllegalArgumentException("Malformed URL: httpnotaurl"));
        assertTrue(enricher.enrich("httpnotaurl").reply().isEmpty());
    }

    @Test
    void sameResponseGivesSameReply() throws IOException {
        var html = "<title>Stable</title><meta name=description content=Same>";
        when(fetcher.fetch(anyString())).thenAnswer(inv -> Jsoup.parse(html));

        var first = enricher.enrich("https://stable.example");
        var second = enricher.enrich("https://stable.example");

        assertEquals(first, second);
        assertEquals(Optional.of("Page Info: Title: Stable, Description: Same"), first.reply());
    }
}
