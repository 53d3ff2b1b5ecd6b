package com.relaybot.links;

import org.jsoup.nodes.Document;

import java.io.IOException;

@FunctionalInterface
public interface PageFetcher {

    /**
     * Downloads and parses an HTML page. Implementations must bound the call
     * with a timeout and fail on non-2xx responses.
     */
    Document fetch(String url) throws IOException;
}
