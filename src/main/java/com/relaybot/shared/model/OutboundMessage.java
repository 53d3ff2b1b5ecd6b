package com.relaybot.shared.model;

import java.util.Objects;

public record OutboundMessage(
    String channelId,
    String content
) {
    public OutboundMessage {
        Objects.requireNonNull(channelId, "channelId");
        // one reply is one protocol line
        content = content == null ? "" : content.replaceAll("[\\r\\n]+", " ").strip();
    }
}
