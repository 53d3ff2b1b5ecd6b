package com.relaybot.gateway;

import com.relaybot.channels.IrcAdapter;
import com.relaybot.dispatch.MessageDispatcher;
import com.relaybot.links.JsoupPageFetcher;
import com.relaybot.links.LinkClassifier;
import com.relaybot.links.PageSummaryEnricher;
import com.relaybot.links.UrlExtractor;
import com.relaybot.links.VideoIdExtractor;
import com.relaybot.links.VideoTitleEnricher;
import com.relaybot.observability.BotMetrics;
import com.relaybot.shared.config.ConfigLoader;
import com.relaybot.stocks.StockCommandHandler;
import com.relaybot.stocks.YahooQuoteProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

public class RelayBotApp {

    private static final Logger log = LoggerFactory.getLogger(RelayBotApp.class);

    public static void main(String[] args) {
        var config = args.length > 0 ? ConfigLoader.load(Path.of(args[0])) : ConfigLoader.load();
        var metrics = new BotMetrics();

        // Links
        var links = config.links();
        var fetchTimeout = Duration.ofSeconds(links.fetchTimeoutSeconds());
        var fetcher = new JsoupPageFetcher(fetchTimeout, links.userAgent());
        var classifier = new LinkClassifier(
                List.of(new VideoTitleEnricher(new VideoIdExtractor(), fetcher, metrics)),
                new PageSummaryEnricher(fetcher, metrics));

        // Stocks
        var stockHandler = new StockCommandHandler(new YahooQuoteProvider(config.stocks()), metrics);

        // Channel
        var adapter = new IrcAdapter(config.irc());
        var dispatcher = new MessageDispatcher(stockHandler, new UrlExtractor(), classifier, adapter,
                enrichmentPool(links.workers()), links.workers(), fetchTimeout, metrics);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            adapter.stop();
            dispatcher.close();
            log.info("Shutdown: {}", metrics.summary());
        }, "relaybot-shutdown"));

        log.info("Starting bot {} for {} on {}:{}", config.irc().nickname(), config.irc().channel(),
                config.irc().server(), config.irc().port());
        adapter.start(dispatcher);
    }

    private static ExecutorService enrichmentPool(int workers) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, r -> {
            var t = new Thread(r, "link-enricher-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
