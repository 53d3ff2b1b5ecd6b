package com.relaybot.stocks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.relaybot.shared.config.StocksConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Quotes from the Yahoo Finance v7 quote endpoint. Yahoo requires a session
 * cookie (set by fc.yahoo.com) and a matching crumb; both are obtained lazily
 * and dropped when Yahoo rejects them, so the next lookup re-authenticates.
 */
public class YahooQuoteProvider implements QuoteProvider {

    private static final Logger log = LoggerFactory.getLogger(YahooQuoteProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String COOKIE_URL = "https://fc.yahoo.com";
    private static final String CRUMB_URL = "https://query2.finance.yahoo.com/v1/test/getcrumb";
    private static final String QUOTE_URL = "https://query2.finance.yahoo.com/v7/finance/quote";
    private static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
            + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final HttpClient httpClient;
    private final Duration timeout;
    private volatile String crumb;

    public YahooQuoteProvider(StocksConfig config) {
        this.timeout = Duration.ofSeconds(config.timeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
                .build();
    }

    @Override
    public Optional<QuoteSnapshot> lookup(String symbol) {
        try {
            var url = QUOTE_URL + "?symbols=" + URLEncoder.encode(symbol, StandardCharsets.UTF_8)
                    + "&crumb=" + URLEncoder.encode(ensureCrumb(), StandardCharsets.UTF_8);
            var resp = httpClient.send(request(url, "application/json"), HttpResponse.BodyHandlers.ofString());
            int status = resp.statusCode();
            if (status == 401 || status == 403) {
                crumb = null;
                throw new QuoteException("Yahoo Finance rejected credentials: HTTP " + status);
            }
            if (status != 200) {
                throw new QuoteException("Yahoo Finance quote error " + status + " for " + symbol);
            }
            return parseQuote(resp.body());
        } catch (IOException e) {
            throw new QuoteException("Yahoo Finance request failed for " + symbol, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QuoteException("Interrupted while fetching " + symbol, e);
        }
    }

    private synchronized String ensureCrumb() throws IOException, InterruptedException {
        if (crumb != null) return crumb;

        // the cookie comes back on an error page; only the Set-Cookie header matters
        var cookieResp = httpClient.send(request(COOKIE_URL, "text/html"), HttpResponse.BodyHandlers.discarding());
        log.debug("fc.yahoo.com responded with HTTP {}", cookieResp.statusCode());

        var crumbResp = httpClient.send(request(CRUMB_URL, "text/plain"), HttpResponse.BodyHandlers.ofString());
        if (crumbResp.statusCode() != 200) {
            throw new QuoteException("Yahoo Finance crumb request returned " + crumbResp.statusCode());
        }
        var value = crumbResp.body().strip();
        if (value.isEmpty() || value.startsWith("{")) {
            throw new QuoteException("Yahoo Finance returned an invalid crumb");
        }
        crumb = value;
        log.info("Yahoo Finance credentials initialised (crumb length={})", value.length());
        return value;
    }

    private HttpRequest request(String url, String accept) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(timeout)
                .header("User-Agent", USER_AGENT)
                .header("Accept", accept)
                .GET().build();
    }

    static Optional<QuoteSnapshot> parseQuote(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new QuoteException("Malformed Yahoo Finance response", e);
        }
        var response = root == null ? null : root.get("quoteResponse");
        if (response == null || !response.isObject()) {
            throw new QuoteException("Unexpected Yahoo Finance response");
        }
        var error = response.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new QuoteException("Yahoo Finance error: " + error.path("description").asText(error.toString()));
        }
        var result = response.path("result");
        if (!result.isArray() || result.isEmpty()) return Optional.empty();

        var quote = result.get(0);
        var name = text(quote, "longName");
        if (name == null) name = text(quote, "shortName");
        return Optional.of(new QuoteSnapshot(
                name,
                text(quote, "currency"),
                number(quote, "regularMarketPrice"),
                number(quote, "preMarketPrice"),
                number(quote, "postMarketPrice"),
                number(quote, "regularMarketPreviousClose")
        ));
    }

    private static String text(JsonNode node, String field) {
        var value = node.get(field);
        return value != null && value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static Double number(JsonNode node, String field) {
        var value = node.get(field);
        if (value == null) return null;
        // some endpoints wrap numbers as {"raw": 1.0, "fmt": "1.00"}
        if (value.isObject()) value = value.get("raw");
        return value != null && value.isNumber() ? value.asDouble() : null;
    }
}
