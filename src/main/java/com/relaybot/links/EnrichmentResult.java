package com.relaybot.links;

import java.util.Optional;

/**
 * Outcome of enriching one link. Only {@link Ok} produces a channel reply;
 * {@link Skipped} keeps the reason for logs and tests.
 */
public sealed interface EnrichmentResult permits EnrichmentResult.Ok, EnrichmentResult.Skipped {

    Optional<String> reply();

    static EnrichmentResult ok(String text) {
        return new Ok(text);
    }

    static EnrichmentResult skipped(String url, String reason) {
        return new Skipped(url, reason);
    }

    record Ok(String text) implements EnrichmentResult {
        @Override
        public Optional<String> reply() {
            return Optional.of(text);
        }
    }

    record Skipped(String url, String reason) implements EnrichmentResult {
        @Override
        public Optional<String> reply() {
            return Optional.empty();
        }
    }
}
