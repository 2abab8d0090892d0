package com.example.console_relay.support;

import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.example.console_relay.socket.UpstreamConsoleConnector;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stands in for the Proxmox console endpoint. Depending on the mode it accepts the
 * connection with a {@link RecordingWebSocketSession}, rejects it, or never answers.
 */
public class FakeConsoleConnector implements UpstreamConsoleConnector {

    public enum Mode { ACCEPT, REJECT_AUTH, UNREACHABLE, HANG }

    private final AtomicInteger attempts = new AtomicInteger();
    private final List<RecordingWebSocketSession> upstreams = new CopyOnWriteArrayList<>();
    private final List<WebSocketHandler> handlers = new CopyOnWriteArrayList<>();
    private volatile Mode mode = Mode.ACCEPT;

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public int attempts() {
        return attempts.get();
    }

    public RecordingWebSocketSession upstream(int index) {
        return upstreams.get(index);
    }

    public WebSocketHandler handler(int index) {
        return handlers.get(index);
    }

    @Override
    public CompletableFuture<WebSocketSession> connect(ConsoleTicket ticket, WebSocketHandler handler) {
        int attempt = attempts.incrementAndGet();
        handlers.add(handler);
        switch (mode) {
            case REJECT_AUTH:
                return CompletableFuture.failedFuture(
                        new ConsoleRelayException(RelayFailure.UPSTREAM_AUTH_FAILED, "console rejected the ticket"));
            case UNREACHABLE:
                return CompletableFuture.failedFuture(
                        new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "console endpoint unreachable"));
            case HANG:
                return new CompletableFuture<>();
            default:
                RecordingWebSocketSession upstream = new RecordingWebSocketSession("upstream-" + attempt);
                upstreams.add(upstream);
                try {
                    handler.afterConnectionEstablished(upstream);
                } catch (Exception e) {
                    return CompletableFuture.failedFuture(e);
                }
                return CompletableFuture.completedFuture(upstream);
        }
    }
}
