package com.relaybot.channels;

import com.relaybot.shared.model.InboundMessage;

@FunctionalInterface
public interface MessageSink {
    void accept(InboundMessage message);
}
