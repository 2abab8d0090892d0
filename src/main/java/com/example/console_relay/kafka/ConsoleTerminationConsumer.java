package com.example.console_relay.kafka;

import com.example.console_relay.dto.ConsoleTerminationRequest;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.dto.ResourceKind;
import com.example.console_relay.service.ConsoleRelayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "relay.kafka.enabled", havingValue = "true")
public class ConsoleTerminationConsumer {

    static final String DEFAULT_REASON = "terminated by control plane";

    private final ConsoleRelayService relayService;

    @KafkaListener(
            topics = "console-session-termination-requests",
            groupId = "${relay.kafka.group-id:console-relay}",
            containerFactory = "terminationKafkaListenerContainerFactory"
    )
    public void consumeTerminationRequest(ConsoleTerminationRequest request) {
        log.info("Received console termination request: sessionId={}, resource={}/{}/{}",
                request.getSessionId(), request.getNode(), request.getResourceKind(), request.getResourceId());

        try {
            handle(request);
        } catch (Exception e) {
            log.error("Failed to process console termination request: {}", e.getMessage(), e);
        }
    }

    void handle(ConsoleTerminationRequest request) {
        String reason = request.getReason() == null || request.getReason().isBlank()
                ? DEFAULT_REASON
                : request.getReason();

        if (request.getSessionId() != null && !request.getSessionId().isBlank()) {
            if (!relayService.terminate(request.getSessionId(), reason)) {
                log.info("Console session {} is not open here, nothing to terminate", request.getSessionId());
            }
            return;
        }
        if (request.getNode() != null && request.getResourceId() != null) {
            ResourceDescriptor resource = ResourceDescriptor.of(request.getNode(), request.getResourceId(),
                    ResourceKind.parse(request.getResourceKind()));
            relayService.terminateResource(resource, reason);
            return;
        }
        log.warn("Ignoring termination request without session id or resource: {}", request);
    }
}
