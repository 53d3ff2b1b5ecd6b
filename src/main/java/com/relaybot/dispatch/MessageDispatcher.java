package com.relaybot.dispatch;

import com.relaybot.channels.ChannelAdapter;
import com.relaybot.channels.MessageSink;
import com.relaybot.links.EnrichmentResult;
import com.relaybot.links.LinkClassifier;
import com.relaybot.links.UrlExtractor;
import com.relaybot.observability.BotMetrics;
import com.relaybot.shared.model.InboundMessage;
import com.relaybot.shared.model.OutboundMessage;
import com.relaybot.stocks.StockCommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Routes each channel message either to the stock command or to link
 * enrichment. Links in one message are enriched in parallel on the worker pool
 * and replied to as they complete; one slow or failing link never holds back
 * the others beyond the per-message deadline.
 */
public class MessageDispatcher implements MessageSink, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);
    static final Duration GRACE = Duration.ofSeconds(5);

    private final StockCommandHandler stockHandler;
    private final UrlExtractor urlExtractor;
    private final LinkClassifier classifier;
    private final ChannelAdapter channel;
    private final ExecutorService enrichmentPool;
    private final int workers;
    private final Duration fetchTimeout;
    private final BotMetrics metrics;

    public MessageDispatcher(StockCommandHandler stockHandler, UrlExtractor urlExtractor,
                             LinkClassifier classifier, ChannelAdapter channel,
                             ExecutorService enrichmentPool, int workers,
                             Duration fetchTimeout, BotMetrics metrics) {
        this.stockHandler = stockHandler;
        this.urlExtractor = urlExtractor;
        this.classifier = classifier;
        this.channel = channel;
        this.enrichmentPool = enrichmentPool;
        this.workers = Math.max(workers, 1);
        this.fetchTimeout = fetchTimeout;
        this.metrics = metrics;
    }

    @Override
    public void accept(InboundMessage message) {
        metrics.messagesReceived().increment();
        log.debug("Received message in {}: {}", message.channelId(), message.content());
        try {
            if (stockHandler.matches(message.content())) {
                reply(message, stockHandler.handle(message.content()));
            } else {
                enrichLinks(message);
            }
        } catch (RuntimeException e) {
            log.error("Failed to dispatch message in {}", message.channelId(), e);
        }
    }

    private void enrichLinks(InboundMessage message) {
        var urls = urlExtractor.extract(message.content()).collect(Collectors.toList());
        if (urls.isEmpty()) return;
        log.debug("Extracted URLs: {}", urls);

        var completion = new ExecutorCompletionService<EnrichmentResult>(enrichmentPool);
        var pending = new ArrayList<Future<EnrichmentResult>>();
        for (var url : urls) {
            pending.add(completion.submit(() -> classifier.enrich(url)));
        }

        long deadline = System.nanoTime() + deadlineFor(urls.size()).toNanos();
        try {
            for (int done = 0; done < pending.size(); done++) {
                long remaining = Math.max(deadline - System.nanoTime(), 0);
                var next = completion.poll(remaining, TimeUnit.NANOSECONDS);
                if (next == null) {
                    log.warn("{} link(s) still unresolved after {}s, giving up on them",
                            pending.size() - done, deadlineFor(urls.size()).toSeconds());
                    break;
                }
                deliver(message, next);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pending.forEach(f -> f.cancel(true));
        }
    }

    private void deliver(InboundMessage message, Future<EnrichmentResult> future) throws InterruptedException {
        EnrichmentResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            log.error("Link enrichment crashed", e.getCause());
            metrics.enrichments("skipped").increment();
            return;
        }
        if (result instanceof EnrichmentResult.Skipped skipped) {
            log.debug("No reply for {}: {}", skipped.url(), skipped.reason());
            metrics.enrichments("skipped").increment();
            return;
        }
        metrics.enrichments("ok").increment();
        result.reply().ifPresent(text -> reply(message, text));
    }

    Duration deadlineFor(int links) {
        int rounds = (links + workers - 1) / workers;
        return fetchTimeout.plus(GRACE).multipliedBy(rounds);
    }

    private void reply(InboundMessage message, String text) {
        try {
            channel.send(new OutboundMessage(message.channelId(), text));
            metrics.repliesSent().increment();
        } catch (RuntimeException e) {
            log.error("Failed to send reply to {}", message.channelId(), e);
        }
    }

    @Override
    public void close() {
        enrichmentPool.shutdownNow();
    }
}
