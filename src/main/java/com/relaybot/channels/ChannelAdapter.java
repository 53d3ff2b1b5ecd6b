package com.relaybot.channels;

import com.relaybot.shared.model.OutboundMessage;

public interface ChannelAdapter {
    String id();
    void start(MessageSink sink);

    /** Safe to call from several threads; each call writes one whole line. */
    void send(OutboundMessage msg);

    void stop();
}
