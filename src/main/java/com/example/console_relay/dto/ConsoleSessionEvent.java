package com.example.console_relay.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ConsoleSessionEvent {

    public enum Type { OPENED, CLOSED, ERRORED }

    private String sessionId;
    private Type type;
    private String node;
    private String resourceKind;
    private Integer resourceId;
    private Long operatorId;
    private Integer closeCode;
    private String reason;
    private Instant timestamp;
}
