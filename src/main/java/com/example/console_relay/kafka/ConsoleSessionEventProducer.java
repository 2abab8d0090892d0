package com.example.console_relay.kafka;

import com.example.console_relay.dto.ConsoleSessionEvent;
import com.example.console_relay.service.ConsoleSessionEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.kafka.enabled", havingValue = "true")
public class ConsoleSessionEventProducer implements ConsoleSessionEventPublisher {

    static final String TOPIC = "console-session-events";

    private final KafkaTemplate<String, ConsoleSessionEvent> consoleSessionEventKafkaTemplate;

    @Override
    public void publish(ConsoleSessionEvent event) {
        log.info("Sending console session event to Kafka: type={}, sessionId={}",
                event.getType(), event.getSessionId());
        consoleSessionEventKafkaTemplate.send(TOPIC, event.getSessionId(), event)
                .whenComplete((result, error) -> {
                    if (error != null) {
                        log.error("Failed to send console session event {} for {}: {}",
                                event.getType(), event.getSessionId(), error.getMessage());
                    }
                });
    }
}
