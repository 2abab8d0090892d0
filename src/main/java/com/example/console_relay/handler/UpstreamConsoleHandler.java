package com.example.console_relay.handler;

import com.example.console_relay.dto.ConsoleProtocol;
import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.example.console_relay.session.ConsoleSession;
import com.example.console_relay.session.SessionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.concurrent.CompletableFuture;

/**
 * Upstream side of one console session. Until the console handshake completes, frames
 * from the console are handshake replies; afterwards they are relayed to the operator.
 */
@Slf4j
public class UpstreamConsoleHandler extends AbstractWebSocketHandler {

    private static final byte[] HANDSHAKE_OK = "OK".getBytes(StandardCharsets.US_ASCII);

    private final ConsoleSession consoleSession;
    private final ConsoleTicket ticket;
    private final ConsoleProtocol protocol;
    private final CompletableFuture<Void> handshake = new CompletableFuture<>();

    public UpstreamConsoleHandler(ConsoleSession consoleSession, ConsoleTicket ticket, ConsoleProtocol protocol) {
        this.consoleSession = consoleSession;
        this.ticket = ticket;
        this.protocol = protocol;
    }

    /**
     * Completes once the console accepted the ticket.
     */
    public CompletableFuture<Void> handshake() {
        return handshake;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession upstream) throws Exception {
        consoleSession.attachUpstream(upstream);
        if (consoleSession.isTerminationRequested()) {
            // operator left while we were connecting
            log.info("[{}] Console connected after session ended, closing it", consoleSession.getId());
            handshake.cancel(false);
            upstream.close(CloseStatus.GOING_AWAY);
            return;
        }
        if (protocol == ConsoleProtocol.VNC) {
            handshake.complete(null);
            return;
        }
        if (ticket.getUpstreamUser() == null) {
            handshake.completeExceptionally(new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                    "ticket carries no console user"));
            return;
        }
        upstream.sendMessage(new TextMessage(ticket.getUpstreamUser() + ":" + ticket.getValue() + "\n"));
    }

    @Override
    protected void handleTextMessage(WebSocketSession upstream, TextMessage message) {
        onFrame(message);
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession upstream, BinaryMessage message) {
        onFrame(message);
    }

    private void onFrame(WebSocketMessage<?> message) {
        if (handshake.isDone()) {
            consoleSession.forwardFromUpstream(message);
            return;
        }
        byte[] reply = payloadBytes(message);
        if (!startsWith(reply, HANDSHAKE_OK)) {
            log.warn("[{}] Unexpected console handshake reply ({} bytes)", consoleSession.getId(), reply.length);
            handshake.completeExceptionally(new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                    "unexpected console handshake reply"));
            return;
        }
        // output may ride in the same frame as the OK
        if (reply.length > HANDSHAKE_OK.length) {
            byte[] rest = Arrays.copyOfRange(reply, HANDSHAKE_OK.length, reply.length);
            consoleSession.forwardFromUpstream(message instanceof TextMessage
                    ? new TextMessage(new String(rest, StandardCharsets.UTF_8))
                    : new BinaryMessage(rest));
        }
        handshake.complete(null);
    }

    @Override
    public void handleTransportError(WebSocketSession upstream, Throwable exception) {
        if (!handshake.isDone()) {
            handshake.completeExceptionally(new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                    "console transport error during handshake", exception));
            return;
        }
        log.debug("[{}] Console transport error: {}", consoleSession.getId(), exception.getMessage());
        consoleSession.signal(SessionOutcome.upstreamFailed(exception));
    }

    @Override
    public void afterConnectionClosed(WebSocketSession upstream, CloseStatus status) {
        if (!handshake.isDone()) {
            handshake.completeExceptionally(new ConsoleRelayException(RelayFailure.UPSTREAM_AUTH_FAILED,
                    "console closed during handshake (" + status.getCode() + ")"));
            return;
        }
        consoleSession.signal(SessionOutcome.upstreamClosed(status));
    }

    private static byte[] payloadBytes(WebSocketMessage<?> message) {
        if (message instanceof TextMessage) {
            return ((TextMessage) message).getPayload().getBytes(StandardCharsets.UTF_8);
        }
        ByteBuffer buffer = ((BinaryMessage) message).getPayload().duplicate();
        byte[] bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
