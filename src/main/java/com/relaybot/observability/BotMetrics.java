package com.relaybot.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public class BotMetrics {

    private final MeterRegistry registry;

    public BotMetrics() {
        this(new SimpleMeterRegistry());
    }

    public BotMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter messagesReceived() {
        return Counter.builder("relaybot.messages").register(registry);
    }

    public Counter repliesSent() {
        return Counter.builder("relaybot.replies").register(registry);
    }

    public Counter enrichments(String result) {
        return Counter.builder("relaybot.enrichment").tag("result", result).register(registry);
    }

    public Timer fetchLatency(String strategy) {
        return Timer.builder("relaybot.fetch.latency").tag("strategy", strategy).register(registry);
    }

    public Counter stockLookups(String outcome) {
        return Counter.builder("relaybot.stock.lookups").tag("outcome", outcome).register(registry);
    }

    public String summary() {
        return String.format("messages=%d replies=%d enrichments(ok=%d, skipped=%d) fetches=%d (mean %.0f ms)",
                (long) messagesReceived().count(),
                (long) repliesSent().count(),
                (long) enrichments("ok").count(),
                (long) enrichments("skipped").count(),
                registry.find("relaybot.fetch.latency").timers().stream().mapToLong(Timer::count).sum(),
                registry.find("relaybot.fetch.latency").timers().stream()
                        .mapToDouble(t -> t.mean(TimeUnit.MILLISECONDS)).average().orElse(0));
    }
}
