package com.example.console_relay.dto;

import com.example.console_relay.session.ConsoleSessionState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ConsoleSessionView {
    String id;
    String node;
    String resourceKind;
    int resourceId;
    Long operatorId;
    ConsoleSessionState state;
    Instant createdAt;
    Instant lastActivityAt;
}
