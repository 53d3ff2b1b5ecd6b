package com.relaybot.shared.config;

public record StocksConfig(int timeoutSeconds) {

    public static StocksConfig defaults() {
        return new StocksConfig(10);
    }
}
