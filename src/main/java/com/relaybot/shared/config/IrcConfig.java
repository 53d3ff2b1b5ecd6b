package com.relaybot.shared.config;

public record IrcConfig(
    String server,
    int port,
    boolean tls,
    String nickname,
    String realname,
    String channel,
    String serverPassword,
    String nickservPassword,
    long reconnectDelaySeconds
) {
    public IrcConfig {
        if (channel != null && !channel.isBlank()
                && !channel.startsWith("#") && !channel.startsWith("&")) {
            channel = "#" + channel;
        }
    }

    public boolean hasServerPassword() {
        return serverPassword != null && !serverPassword.isBlank();
    }

    public boolean hasNickservPassword() {
        return nickservPassword != null && !nickservPassword.isBlank();
    }

    public static IrcConfig defaults() {
        return new IrcConfig("irc.libera.chat", 6667, false, "RelayBot", "RelayBot",
                "#relaybot", "", "", 60);
    }
}
