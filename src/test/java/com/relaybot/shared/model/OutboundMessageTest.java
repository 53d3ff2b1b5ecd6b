package com.relaybot.shared.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OutboundMessageTest {

    @Test
    void foldsLineBreaksIntoSpaces() {
        var msg = new OutboundMessage("#chan", "Title: A\r\nB\n\nC\n");
        assertEquals("Title: A B C", msg.content());
    }

    @Test
    void nullContentBecomesEmpty() {
        assertEquals("", new OutboundMessage("#chan", null).content());
        assertEquals("", new InboundMessage("u", "#chan", null, Instant.now()).content());
    }

    @Test
    void channelIsRequired() {
        assertThrows(NullPointerException.class, () -> new OutboundMessage(null, "x"));
        assertThrows(NullPointerException.class, () -> new InboundMessage("u", null, "x", Instant.now()));
    }
}
