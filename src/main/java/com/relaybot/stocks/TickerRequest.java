package com.relaybot.stocks;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

public record TickerRequest(String symbol) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /** Accepts exactly {@code <command> <symbol>}; any other shape yields empty. */
    public static Optional<TickerRequest> parse(String commandLine) {
        if (commandLine == null) return Optional.empty();
        var parts = WHITESPACE.split(commandLine.strip());
        if (parts.length != 2) return Optional.empty();
        return Optional.of(new TickerRequest(parts[1].toUpperCase(Locale.ROOT)));
    }
}
