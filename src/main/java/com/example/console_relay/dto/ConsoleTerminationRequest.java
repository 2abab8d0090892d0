package com.example.console_relay.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asks the relay to force-close sessions, either one by id or every session on a resource
 * (e.g. the resource was deleted elsewhere).
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class ConsoleTerminationRequest {
    private String sessionId;
    private String node;
    private String resourceKind;
    private Integer resourceId;
    private String reason;
}
