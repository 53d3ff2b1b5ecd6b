package com.relaybot.observability;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BotMetricsTest {

    @Test
    void registersAllMeters() {
        var metrics = new BotMetrics();
        assertNotNull(metrics.registry());
        assertNotNull(metrics.messagesReceived());
        assertNotNull(metrics.repliesSent());
        assertNotNull(metrics.enrichments("ok"));
        assertNotNull(metrics.fetchLatency("page"));
        assertNotNull(metrics.stockLookups("regular"));
    }

    @Test
    void taggedCountersAreIndependent() {
        var metrics = new BotMetrics();
        metrics.enrichments("ok").increment();
        metrics.enrichments("ok").increment();
        metrics.enrichments("skipped").increment();
        assertEquals(2.0, metrics.enrichments("ok").count());
        assertEquals(1.0, metrics.enrichments("skipped").count());
    }

    @Test
    void summaryReportsCounts() {
        var metrics = new BotMetrics();
        metrics.messagesReceived().increment();
        metrics.repliesSent().increment();
        metrics.fetchLatency("video").record(Duration.ofMillis(40));
        metrics.fetchLatency("page").record(Duration.ofMillis(60));

        var summary = metrics.summary();

        assertTrue(summary.contains("messages=1"));
        assertTrue(summary.contains("replies=1"));
        assertTrue(summary.contains("fetches=2"));
    }
}
