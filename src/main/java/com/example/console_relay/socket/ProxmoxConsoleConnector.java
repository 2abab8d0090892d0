package com.example.console_relay.socket;

import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Connects to {@code /api2/json/nodes/{node}/{kind}/{vmid}/vncwebsocket} on the Proxmox
 * host, presenting the console ticket both as {@code vncticket} and as the
 * {@code PVEAuthCookie}.
 */
@Component
@Slf4j
public class ProxmoxConsoleConnector implements UpstreamConsoleConnector {

    // Tomcat reports a refused upgrade as "The HTTP response from the server [401] ..."
    private static final Pattern AUTH_REJECTED =
            Pattern.compile("\\[(401|403)]|status(?: code)?:? (401|403)", Pattern.CASE_INSENSITIVE);

    private final WebSocketClient webSocketClient;
    private final String scheme;
    private final String host;
    private final int port;
    private final String apiToken;

    public ProxmoxConsoleConnector(@Qualifier("consoleWebSocketClient") WebSocketClient webSocketClient,
                                   @Value("${proxmox.websocket-scheme:wss}") String scheme,
                                   @Value("${proxmox.host}") String host,
                                   @Value("${proxmox.port:8006}") int port,
                                   @Value("${proxmox.token-name:}") String tokenName,
                                   @Value("${proxmox.token-value:}") String tokenValue) {
        this.webSocketClient = webSocketClient;
        this.scheme = scheme;
        this.host = host;
        this.port = port;
        this.apiToken = tokenName.isEmpty() ? null : "PVEAPIToken=" + tokenName + "=" + tokenValue;
    }

    @Override
    public CompletableFuture<WebSocketSession> connect(ConsoleTicket ticket, WebSocketHandler handler) {
        URI uri = consoleUri(ticket);
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add(HttpHeaders.COOKIE, "PVEAuthCookie=" + ticket.getValue());
        if (apiToken != null) {
            headers.add(HttpHeaders.AUTHORIZATION, apiToken);
        }

        log.info("Connecting to console of {} on port {}", ticket.getIssuedFor(), ticket.getTargetPort());
        CompletableFuture<WebSocketSession> connect;
        try {
            connect = webSocketClient.execute(handler, headers, uri);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(classify(ticket.getIssuedFor(), e));
        }
        return connect.handle((session, error) -> {
            if (error != null) {
                throw classify(ticket.getIssuedFor(), error);
            }
            return session;
        });
    }

    URI consoleUri(ConsoleTicket ticket) {
        ResourceDescriptor resource = ticket.getIssuedFor();
        return UriComponentsBuilder.newInstance()
                .scheme(scheme)
                .host(host)
                .port(port)
                .path("/api2/json/nodes/{node}/{kind}/{vmid}/vncwebsocket")
                .queryParam("port", "{port}")
                .queryParam("vncticket", "{ticket}")
                .encode()
                .buildAndExpand(resource.getNode(), resource.getKind().getWireName(), resource.getResourceId(),
                        ticket.getTargetPort(), ticket.getValue())
                .toUri();
    }

    static ConsoleRelayException classify(ResourceDescriptor resource, Throwable error) {
        Throwable root = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (root instanceof ConsoleRelayException) {
            return (ConsoleRelayException) root;
        }
        for (Throwable t = root; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && AUTH_REJECTED.matcher(message).find()) {
                log.warn("Console endpoint of {} rejected the ticket: {}", resource, message);
                return new ConsoleRelayException(RelayFailure.UPSTREAM_AUTH_FAILED, "console rejected the ticket", root);
            }
        }
        log.warn("Console endpoint of {} unreachable: {}", resource, root.getMessage());
        return new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "console endpoint unreachable", root);
    }
}
