package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleProtocol;
import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Mints console tickets from the Proxmox control plane. Holds no state of its own; the
 * minted ticket is handed to {@link ConsoleTicketStore} by the caller.
 */
@Service
@Slf4j
public class TicketExchangeService {

    private final ProxmoxApiClient proxmoxApiClient;
    private final Clock clock;
    private final ConsoleProtocol protocol;
    private final Duration ticketTtl;

    public TicketExchangeService(ProxmoxApiClient proxmoxApiClient,
                                 Clock clock,
                                 @Value("${relay.console.protocol:VNC}") ConsoleProtocol protocol,
                                 @Value("${relay.ticket.ttl:30s}") Duration ticketTtl) {
        this.proxmoxApiClient = proxmoxApiClient;
        this.clock = clock;
        this.protocol = protocol;
        this.ticketTtl = ticketTtl;
    }

    public ConsoleTicket mint(OperatorIdentity operator, ResourceDescriptor resource) {
        JsonNode status = proxmoxApiClient.getStatus(resource);
        String runState = status.path("status").asText("unknown");
        if (!"running".equals(runState)) {
            log.info("Console requested for {} but it is {}", resource, runState);
            throw new ConsoleRelayException(RelayFailure.RESOURCE_NOT_RUNNING, resource + " is " + runState);
        }

        JsonNode proxy = proxmoxApiClient.createConsoleProxy(resource, protocol);
        String ticket = proxy.path("ticket").asText("");
        int port = proxy.path("port").asInt(0);
        if (ticket.isEmpty() || port <= 0) {
            log.error("Proxmox {} for {} returned no usable ticket/port", protocol.getProxyEndpoint(), resource);
            throw new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "Proxmox returned an unusable console ticket");
        }

        Instant now = clock.instant();
        ConsoleTicket minted = ConsoleTicket.builder()
                .value(ticket)
                .targetPort(port)
                .issuedFor(resource)
                .issuedTo(operator.getId())
                .upstreamUser(proxy.path("user").asText(null))
                .issuedAt(now)
                .expiresAt(now.plus(ticketTtl))
                .build();
        log.info("Minted {}", minted);
        return minted;
    }

    public ConsoleProtocol getProtocol() {
        return protocol;
    }
}
