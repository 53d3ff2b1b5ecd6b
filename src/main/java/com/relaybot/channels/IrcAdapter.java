package com.relaybot.channels;

import com.relaybot.shared.config.IrcConfig;
import com.relaybot.shared.model.InboundMessage;
import com.relaybot.shared.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLSocketFactory;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Single-server, single-channel IRC client. The read loop runs on its own
 * thread and hands channel messages to a one-thread dispatch executor, so
 * PINGs keep being answered while a message is being processed.
 */
public class IrcAdapter implements ChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(IrcAdapter.class);
    private static final int CONNECT_TIMEOUT_MS = 30_000;
    private static final char CTCP_DELIMITER = '\u0001';

    /** Opens the network connection; replaced in tests. */
    @FunctionalInterface
    public interface Connector {
        Connection open(IrcConfig config) throws IOException;
    }

    public record Connection(BufferedReader reader, Writer writer, Closeable closeable) implements Closeable {
        @Override
        public void close() throws IOException {
            closeable.close();
        }
    }

    private final IrcConfig config;
    private final Connector connector;
    private final Executor dispatchExecutor;
    private final Object writeLock = new Object();

    private volatile boolean running;
    private volatile Connection connection;
    private volatile String currentNick;
    private MessageSink sink;
    private Thread readThread;

    public IrcAdapter(IrcConfig config) {
        this(config, IrcAdapter::openSocket, Executors.newSingleThreadExecutor(r -> {
            var t = new Thread(r, "irc-dispatch");
            t.setDaemon(true);
            return t;
        }));
    }

    IrcAdapter(IrcConfig config, Connector connector, Executor dispatchExecutor) {
        this.config = config;
        this.connector = connector;
        this.dispatchExecutor = dispatchExecutor;
        this.currentNick = config.nickname();
    }

    @Override
    public String id() {
        return "irc";
    }

    @Override
    public void start(MessageSink sink) {
        running = true;
        readThread = new Thread(() -> runLoop(sink), "irc-reader");
        readThread.start();
    }

    private void runLoop(MessageSink sink) {
        while (running) {
            try (var conn = connector.open(config)) {
                runSession(conn, sink);
                if (running) log.warn("Connection to {} closed by server", config.server());
            } catch (IOException e) {
                if (!running) break;
                log.error("IRC connection to {}:{} failed: {}", config.server(), config.port(), e.getMessage());
            } finally {
                connection = null;
            }
            if (!running) break;
            log.info("Reconnecting in {}s", config.reconnectDelaySeconds());
            try {
                Thread.sleep(config.reconnectDelaySeconds() * 1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        log.info("IRC read loop stopped");
    }

    void runSession(Connection conn, MessageSink sink) throws IOException {
        this.sink = sink;
        this.connection = conn;
        currentNick = config.nickname();
        log.info("Connected to {}:{}, registering as {}", config.server(), config.port(), currentNick);
        if (config.hasServerPassword()) {
            sendRaw("PASS " + config.serverPassword());
        }
        sendRaw("NICK " + currentNick);
        sendRaw("USER " + currentNick + " 0 * :" + config.realname());

        String line;
        while ((line = conn.reader().readLine()) != null) {
            handleLine(line);
        }
    }

    void handleLine(String raw) {
        if (raw.isBlank()) return;
        var line = IrcLine.parse(raw);
        switch (line.command()) {
            case "PING" -> sendRaw("PONG :" + line.trailing());
            case "001" -> onWelcome();
            case "433" -> {
                currentNick = currentNick + "_";
                log.warn("Nickname in use, trying {}", currentNick);
                sendRaw("NICK " + currentNick);
            }
            case "JOIN" -> {
                if (currentNick.equalsIgnoreCase(line.nick())) {
                    log.info("Bot joined channel: {}", line.param(0));
                }
            }
            case "PRIVMSG" -> onPrivmsg(line);
            case "ERROR" -> log.warn("Server error: {}", line.trailing());
            default -> log.trace("<< {}", raw);
        }
    }

    private void onWelcome() {
        log.debug("Connected to server, joining channel...");
        if (config.hasNickservPassword()) {
            log.debug("Identifying to NickServ...");
            sendRaw("PRIVMSG NickServ :IDENTIFY " + config.nickservPassword());
        }
        log.debug("Attempting to join channel: {}", config.channel());
        sendRaw("JOIN " + config.channel());
    }

    private void onPrivmsg(IrcLine line) {
        var target = line.param(0);
        if (target == null || !target.equalsIgnoreCase(config.channel())) return;
        var text = line.trailing();
        if (!text.isEmpty() && text.charAt(0) == CTCP_DELIMITER) return;

        var inbound = new InboundMessage(line.nick(), config.channel(), text, Instant.now());
        dispatchExecutor.execute(() -> {
            try {
                sink.accept(inbound);
            } catch (Exception e) {
                log.error("Message handling error in {}", inbound.channelId(), e);
            }
        });
    }

    @Override
    public void send(OutboundMessage msg) {
        if (msg.content().isEmpty()) return;
        sendRaw("PRIVMSG " + config.channel() + " :" + msg.content());
    }

    private void sendRaw(String line) {
        var conn = connection;
        if (conn == null) {
            log.warn("Not connected, dropping line: {}", line.startsWith("PRIVMSG NickServ") ? "[IDENTIFY]" : line);
            return;
        }
        synchronized (writeLock) {
            try {
                conn.writer().write(line);
                conn.writer().write("\r\n");
                conn.writer().flush();
            } catch (IOException e) {
                log.error("Failed to send line to {}", config.server(), e);
            }
        }
    }

    @Override
    public void stop() {
        running = false;
        var conn = connection;
        if (conn != null) {
            sendRaw("QUIT :Shutting down");
            try {
                conn.close();
            } catch (IOException e) {
                log.warn("Failed to close IRC connection: {}", e.getMessage());
            }
        }
        if (readThread != null) readThread.interrupt();
        if (dispatchExecutor instanceof ExecutorService executor) executor.shutdown();
    }

    String currentNick() {
        return currentNick;
    }

    private static Connection openSocket(IrcConfig config) throws IOException {
        Socket socket;
        if (config.tls()) {
            socket = SSLSocketFactory.getDefault().createSocket();
        } else {
            socket = new Socket();
        }
        socket.connect(new InetSocketAddress(config.server(), config.port()), CONNECT_TIMEOUT_MS);
        var reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
        var writer = new BufferedWriter(new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8));
        return new Connection(reader, writer, socket);
    }
}
