package com.relaybot.stocks;

import com.relaybot.observability.BotMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public class StockCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(StockCommandHandler.class);

    public static final String COMMAND = "!stock";
    static final String USAGE = "Usage: !stock TICKER";

    private final QuoteProvider provider;
    private final BotMetrics metrics;

    public StockCommandHandler(QuoteProvider provider, BotMetrics metrics) {
        this.provider = provider;
        this.metrics = metrics;
    }

    public boolean matches(String content) {
        return content.startsWith(COMMAND);
    }

    public String handle(String commandLine) {
        log.debug("Processing stock command: {}", commandLine);
        var request = TickerRequest.parse(commandLine);
        if (request.isEmpty()) {
            metrics.stockLookups("usage").increment();
            return USAGE;
        }
        return lookup(request.get().symbol());
    }

    private String lookup(String symbol) {
        log.debug("Fetching stock price for ticker: {}", symbol);
        try {
            var snapshot = provider.lookup(symbol);
            if (snapshot.isEmpty()) {
                throw new QuoteException("No quote returned for " + symbol);
            }
            log.debug("Stock info for {}: {}", symbol, snapshot.get());
            var quote = PriceQuote.select(symbol, snapshot.get());
            metrics.stockLookups(quote.map(q -> q.priceTier().name().toLowerCase(Locale.ROOT)).orElse("no_data")).increment();
            return quote.map(PriceQuote::describe)
                    .orElse("No price data available for ticker: " + symbol);
        } catch (Exception e) {
            log.error("Error fetching stock price for {}", symbol, e);
            metrics.stockLookups("error").increment();
            return "Error fetching data for ticker: " + symbol + ". Please try again later.";
        }
    }
}
