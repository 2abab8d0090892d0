package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tickets minted through this relay and not yet claimed. Claiming removes the ticket, so
 * a ticket can back at most one upstream connection attempt.
 */
@Service
@Slf4j
public class ConsoleTicketStore {

    private final Map<String, ConsoleTicket> tickets = new ConcurrentHashMap<>();

    // expired tickets are kept a while so late callers get "expired" rather than "unknown"
    private final Duration expiredRetention;

    public ConsoleTicketStore(@Value("${relay.ticket.expired-retention:5m}") Duration expiredRetention) {
        this.expiredRetention = expiredRetention;
    }

    public void register(ConsoleTicket ticket) {
        tickets.put(ticket.getValue(), ticket);
        log.debug("Stored {}", ticket);
    }

    /**
     * Takes the ticket out of the store and checks it against the connection request.
     * A failed claim still consumes the ticket.
     */
    public ConsoleTicket claim(String value, ResourceDescriptor resource, Long operatorId, int port, Instant now) {
        if (value == null || value.isEmpty()) {
            throw new ConsoleRelayException(RelayFailure.TICKET_INVALID, "ticket is required");
        }
        ConsoleTicket ticket = tickets.remove(value);
        if (ticket == null) {
            throw new ConsoleRelayException(RelayFailure.TICKET_INVALID, "ticket unknown or already used");
        }
        if (ticket.isExpired(now)) {
            throw new ConsoleRelayException(RelayFailure.TICKET_EXPIRED, "ticket expired at " + ticket.getExpiresAt());
        }
        if (!ticket.getIssuedFor().equals(resource)) {
            log.warn("Ticket for {} presented for {}", ticket.getIssuedFor(), resource);
            throw new ConsoleRelayException(RelayFailure.TICKET_INVALID, "ticket was issued for another resource");
        }
        if (!Objects.equals(ticket.getIssuedTo(), operatorId)) {
            log.warn("Ticket issued to operator {} presented by operator {}", ticket.getIssuedTo(), operatorId);
            throw new ConsoleRelayException(RelayFailure.TICKET_INVALID, "ticket was issued to another operator");
        }
        if (ticket.getTargetPort() != port) {
            throw new ConsoleRelayException(RelayFailure.TICKET_INVALID, "port does not match ticket");
        }
        return ticket;
    }

    public int purgeExpired(Instant now) {
        Instant cutoff = now.minus(expiredRetention);
        int purged = 0;
        for (Map.Entry<String, ConsoleTicket> entry : tickets.entrySet()) {
            if (entry.getValue().getExpiresAt().isBefore(cutoff) && tickets.remove(entry.getKey(), entry.getValue())) {
                purged++;
            }
        }
        if (purged > 0) {
            log.debug("Purged {} expired console tickets", purged);
        }
        return purged;
    }

    public int size() {
        return tickets.size();
    }
}
