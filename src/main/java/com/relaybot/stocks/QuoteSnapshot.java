package com.relaybot.stocks;

public record QuoteSnapshot(
    String displayName,
    String currency,
    Double regularMarketPrice,
    Double preMarketPrice,
    Double postMarketPrice,
    Double previousClose
) {
    public static QuoteSnapshot empty() {
        return new QuoteSnapshot(null, null, null, null, null, null);
    }
}
