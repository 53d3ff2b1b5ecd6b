package com.relaybot.stocks;

import java.math.BigDecimal;
import java.util.Optional;

public record PriceQuote(
    String companyName,
    String tickerSymbol,
    String currencyCode,
    double priceValue,
    PriceTier priceTier
) {
    static final String UNKNOWN_CURRENCY = "N/A";

    /**
     * Picks the first tier with a price, in the order regular, pre-market,
     * after-hours, previous close.
     */
    public static Optional<PriceQuote> select(String symbol, QuoteSnapshot snapshot) {
        PriceTier tier;
        Double price;
        if (snapshot.regularMarketPrice() != null) {
            tier = PriceTier.REGULAR;
            price = snapshot.regularMarketPrice();
        } else if (snapshot.preMarketPrice() != null) {
            tier = PriceTier.PRE_MARKET;
            price = snapshot.preMarketPrice();
        } else if (snapshot.postMarketPrice() != null) {
            tier = PriceTier.AFTER_HOURS;
            price = snapshot.postMarketPrice();
        } else if (snapshot.previousClose() != null) {
            tier = PriceTier.PREVIOUS_CLOSE;
            price = snapshot.previousClose();
        } else {
            return Optional.empty();
        }

        var company = blank(snapshot.displayName()) ? symbol : snapshot.displayName();
        var currency = blank(snapshot.currency()) ? UNKNOWN_CURRENCY : snapshot.currency();
        return Optional.of(new PriceQuote(company, symbol, currency, price, tier));
    }

    public String describe() {
        return priceTier.format(companyName, tickerSymbol, formatPrice(priceValue), currencyCode);
    }

    static String formatPrice(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static boolean blank(String s) {
        return s == null || s.isBlank();
    }
}
