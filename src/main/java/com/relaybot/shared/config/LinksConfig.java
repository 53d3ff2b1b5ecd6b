package com.relaybot.shared.config;

public record LinksConfig(int fetchTimeoutSeconds, int workers, String userAgent) {

    public static LinksConfig defaults() {
        return new LinksConfig(10, 4, "Mozilla/5.0 (compatible; RelayBot/1.0)");
    }
}
