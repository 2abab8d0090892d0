package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleSessionEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Used when Kafka is switched off; the audit trail then lives in the application log.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "relay.kafka.enabled", havingValue = "false", matchIfMissing = true)
public class LoggingConsoleSessionEventPublisher implements ConsoleSessionEventPublisher {

    @Override
    public void publish(ConsoleSessionEvent event) {
        log.info("Console session event: type={}, sessionId={}, resource={}/{}/{}, operator={}, code={}, reason={}",
                event.getType(), event.getSessionId(), event.getNode(), event.getResourceKind(),
                event.getResourceId(), event.getOperatorId(), event.getCloseCode(), event.getReason());
    }
}
