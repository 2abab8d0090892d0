package com.example.console_relay.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TicketResponse {
    private String ticket;
    private int port;
    private String node;
    private int vmid;
    @JsonProperty("resource_type")
    private String resourceType;
    @JsonProperty("expires_at")
    private Instant expiresAt;

    public static TicketResponse from(ConsoleTicket ticket) {
        ResourceDescriptor resource = ticket.getIssuedFor();
        return new TicketResponse(
                ticket.getValue(),
                ticket.getTargetPort(),
                resource.getNode(),
                resource.getResourceId(),
                resource.getKind().getWireName(),
                ticket.getExpiresAt());
    }
}
