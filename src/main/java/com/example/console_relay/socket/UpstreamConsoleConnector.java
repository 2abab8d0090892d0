package com.example.console_relay.socket;

import com.example.console_relay.dto.ConsoleTicket;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;

import java.util.concurrent.CompletableFuture;

/**
 * Opens the upstream side of a console session.
 */
public interface UpstreamConsoleConnector {

    /**
     * Starts the WebSocket upgrade against the console endpoint the ticket was minted for.
     * The returned future fails with a
     * {@link com.example.console_relay.exception.ConsoleRelayException} carrying
     * {@code UPSTREAM_AUTH_FAILED} or {@code UPSTREAM_UNREACHABLE}.
     */
    CompletableFuture<WebSocketSession> connect(ConsoleTicket ticket, WebSocketHandler handler);
}
