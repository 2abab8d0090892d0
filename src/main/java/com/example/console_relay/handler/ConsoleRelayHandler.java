package com.example.console_relay.handler;

import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.service.ConsoleRelayService;
import com.example.console_relay.session.ConsoleSession;
import com.example.console_relay.session.SessionOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

/**
 * Operator side of the relay. Text and binary frames are both accepted and passed on
 * with their frame type intact.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ConsoleRelayHandler extends AbstractWebSocketHandler {

    static final String CONSOLE_SESSION_ATTR = "consoleSession";

    private final ConsoleRelayService relayService;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        RelayRequest request;
        try {
            request = RelayRequest.fromAttributes(session.getAttributes());
        } catch (ConsoleRelayException e) {
            log.info("Rejecting relay connection {}: {}", session.getId(), e.getMessage());
            session.close(e.toCloseStatus());
            return;
        }
        ConsoleSession consoleSession = relayService.start(session, request);
        session.getAttributes().put(CONSOLE_SESSION_ATTR, consoleSession);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConsoleSession consoleSession = consoleSession(session);
        if (consoleSession != null) {
            consoleSession.forwardFromClient(message);
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        ConsoleSession consoleSession = consoleSession(session);
        if (consoleSession != null) {
            consoleSession.forwardFromClient(message);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        ConsoleSession consoleSession = consoleSession(session);
        log.warn("Transport error on relay connection {}: {}", session.getId(), exception.getMessage());
        if (consoleSession != null) {
            consoleSession.signal(SessionOutcome.clientFailed(exception));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        ConsoleSession consoleSession = consoleSession(session);
        log.info("Relay connection {} closed: {}", session.getId(), status);
        if (consoleSession != null) {
            consoleSession.signal(SessionOutcome.clientClosed(status));
        }
    }

    private static ConsoleSession consoleSession(WebSocketSession session) {
        return (ConsoleSession) session.getAttributes().get(CONSOLE_SESSION_ATTR);
    }
}
