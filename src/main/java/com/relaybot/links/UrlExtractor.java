package com.relaybot.links;

import java.util.regex.Pattern;
import java.util.stream.Stream;

public class UrlExtractor {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String SCHEME_PREFIX = "http";

    public Stream<String> extract(String text) {
        if (text == null || text.isBlank()) return Stream.empty();
        return WHITESPACE.splitAsStream(text)
                .filter(token -> token.startsWith(SCHEME_PREFIX));
    }
}
