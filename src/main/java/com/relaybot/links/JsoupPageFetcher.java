package com.relaybot.links;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

public class JsoupPageFetcher implements PageFetcher {

    private final int timeoutMillis;
    private final String userAgent;

    public JsoupPageFetcher(Duration timeout, String userAgent) {
        this.timeoutMillis = Math.toIntExact(timeout.toMillis());
        this.userAgent = userAgent;
    }

    @Override
    public Document fetch(String url) throws IOException {
        // non-2xx raises HttpStatusException
        var response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMillis)
                .followRedirects(true)
                .ignoreContentType(true)
                .execute();
        if (!isMarkup(response.contentType())) {
            // images, PDFs and other binaries have no title or description to read
            return Document.createShell(response.url().toString());
        }
        return response.parse();
    }

    static boolean isMarkup(String contentType) {
        if (contentType == null) return true;
        var type = contentType.toLowerCase(Locale.ROOT);
        return type.startsWith("text/") || type.contains("xml") || type.contains("html");
    }
}
