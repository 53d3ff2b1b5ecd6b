package com.relaybot.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".relaybot", "config.yaml"
    );

    public static RelayBotConfig load() {
        return load(DEFAULT_PATH);
    }

    public static RelayBotConfig load(Path path) {
        return load(path, System::getenv);
    }

    static RelayBotConfig load(Path path, Environment env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        return new RelayBotConfig(
            parseIrcConfig(section(raw, "irc"), env),
            parseLinksConfig(section(raw, "links")),
            parseStocksConfig(section(raw, "stocks"))
        );
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String name) {
        var value = raw.get(name);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException("Config section " + name + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static IrcConfig parseIrcConfig(Map<String, Object> irc, Environment env) {
        var defaults = IrcConfig.defaults();
        return new IrcConfig(
            env.getOrDefault("RELAYBOT_IRC_SERVER",
                string(irc, "server", defaults.server())),
            intValue("irc.port", env.getOrDefault("RELAYBOT_IRC_PORT",
                string(irc, "port", String.valueOf(defaults.port())))),
            Boolean.TRUE.equals(irc.getOrDefault("tls", defaults.tls())),
            env.getOrDefault("RELAYBOT_IRC_NICK",
                string(irc, "nickname", defaults.nickname())),
            string(irc, "realname", defaults.realname()),
            env.getOrDefault("RELAYBOT_IRC_CHANNEL",
                string(irc, "channel", defaults.channel())),
            env.getOrDefault("RELAYBOT_IRC_SERVER_PASSWORD",
                string(irc, "server-password", defaults.serverPassword())),
            env.getOrDefault("RELAYBOT_NICKSERV_PASSWORD",
                string(irc, "nickserv-password", defaults.nickservPassword())),
            intValue("irc.reconnect-delay",
                string(irc, "reconnect-delay", String.valueOf(defaults.reconnectDelaySeconds())))
        );
    }

    private static LinksConfig parseLinksConfig(Map<String, Object> links) {
        var defaults = LinksConfig.defaults();
        var timeout = intValue("links.fetch-timeout",
            string(links, "fetch-timeout", String.valueOf(defaults.fetchTimeoutSeconds())));
        var workers = intValue("links.workers",
            string(links, "workers", String.valueOf(defaults.workers())));
        if (timeout <= 0) throw new IllegalArgumentException("links.fetch-timeout must be positive");
        if (workers <= 0) throw new IllegalArgumentException("links.workers must be positive");
        return new LinksConfig(timeout, workers, string(links, "user-agent", defaults.userAgent()));
    }

    private static StocksConfig parseStocksConfig(Map<String, Object> stocks) {
        var timeout = intValue("stocks.timeout",
            string(stocks, "timeout", String.valueOf(StocksConfig.defaults().timeoutSeconds())));
        if (timeout <= 0) throw new IllegalArgumentException("stocks.timeout must be positive");
        return new StocksConfig(timeout);
    }

    private static String string(Map<String, Object> section, String key, String fallback) {
        var value = section.get(key);
        return value != null ? String.valueOf(value) : fallback;
    }

    private static int intValue(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    @FunctionalInterface
    interface Environment {
        String get(String name);

        default String getOrDefault(String name, String fallback) {
            var val = get(name);
            return val != null ? val : fallback;
        }
    }
}
