package com.relaybot.stocks;

public enum PriceTier {
    REGULAR("%s (%s) is currently trading at %s %s"),
    PRE_MARKET("%s (%s) is trading at %s %s in pre-market trading."),
    AFTER_HOURS("%s (%s) is trading at %s %s in after-hours trading."),
    PREVIOUS_CLOSE("%s (%s) closed at %s %s on the last trading day.");

    private final String template;

    PriceTier(String template) {
        this.template = template;
    }

    String format(String company, String symbol, String price, String currency) {
        return String.format(template, company, symbol, price, currency);
    }
}
