package com.example.console_relay.dto;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Short-lived, single-use console credential minted by the Proxmox control plane.
 */
@Value
@Builder
public class ConsoleTicket {
    String value;
    int targetPort;
    ResourceDescriptor issuedFor;
    Long issuedTo;
    String upstreamUser;
    Instant issuedAt;
    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        // never log the credential itself
        return "ConsoleTicket(for=" + issuedFor + ", port=" + targetPort + ", to=" + issuedTo
                + ", expiresAt=" + expiresAt + ")";
    }
}
