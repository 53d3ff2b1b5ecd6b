package com.relaybot.channels;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record IrcLine(String prefix, String command, List<String> params) {

    public static IrcLine parse(String raw) {
        var rest = raw.strip();
        if (rest.startsWith("@")) {
            int sp = rest.indexOf(' ');
            rest = sp < 0 ? "" : rest.substring(sp + 1).stripLeading();
        }

        String prefix = null;
        if (rest.startsWith(":")) {
            int sp = rest.indexOf(' ');
            prefix = sp < 0 ? rest.substring(1) : rest.substring(1, sp);
            rest = sp < 0 ? "" : rest.substring(sp + 1).stripLeading();
        }

        String trailing = null;
        int colon = rest.indexOf(" :");
        if (colon >= 0) {
            trailing = rest.substring(colon + 2);
            rest = rest.substring(0, colon);
        } else if (rest.startsWith(":")) {
            trailing = rest.substring(1);
            rest = "";
        }

        var tokens = rest.isBlank() ? new String[0] : rest.strip().split(" +");
        var command = tokens.length > 0 ? tokens[0].toUpperCase(Locale.ROOT) : "";
        var params = new ArrayList<String>();
        for (int i = 1; i < tokens.length; i++) params.add(tokens[i]);
        if (trailing != null) params.add(trailing);
        return new IrcLine(prefix, command, List.copyOf(params));
    }

    /** Nick part of {@code nick!user@host}, or the whole prefix for servers. */
    public String nick() {
        if (prefix == null) return null;
        int bang = prefix.indexOf('!');
        return bang < 0 ? prefix : prefix.substring(0, bang);
    }

    public String param(int index) {
        return index < params.size() ? params.get(index) : null;
    }

    public String trailing() {
        return params.isEmpty() ? "" : params.get(params.size() - 1);
    }
}
