package com.relaybot.shared.model;

import java.time.Instant;
import java.util.Objects;

public record InboundMessage(
    String senderId,
    String channelId,
    String content,
    Instant timestamp
) {
    public InboundMessage {
        Objects.requireNonNull(channelId, "channelId");
        content = content == null ? "" : content;
    }
}
