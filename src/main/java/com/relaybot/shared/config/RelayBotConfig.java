package com.relaybot.shared.config;

public record RelayBotConfig(
    IrcConfig irc,
    LinksConfig links,
    StocksConfig stocks
) {}
