package com.example.console_relay.kafka;

import com.example.console_relay.dto.ConsoleTerminationRequest;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.dto.ResourceKind;
import com.example.console_relay.service.ConsoleRelayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsoleTerminationConsumerTest {

    private ConsoleRelayService relayService;
    private ConsoleTerminationConsumer consumer;

    @BeforeEach
    void setUp() {
        relayService = mock(ConsoleRelayService.class);
        consumer = new ConsoleTerminationConsumer(relayService);
    }

    @Test
    void terminatesSingleSessionById() {
        consumer.consumeTerminationRequest(new ConsoleTerminationRequest("s-1", null, null, null, "lab expired"));

        verify(relayService).terminate("s-1", "lab expired");
        verify(relayService, never()).terminateResource(any(), anyString());
    }

    @Test
    void terminatesEverySessionOnResource() {
        consumer.consumeTerminationRequest(new ConsoleTerminationRequest(null, "pve1", "lxc", 200, null));

        verify(relayService).terminateResource(ResourceDescriptor.of("pve1", 200, ResourceKind.CONTAINER),
                ConsoleTerminationConsumer.DEFAULT_REASON);
    }

    @Test
    void malformedRequestIsLoggedNotThrown() {
        assertDoesNotThrow(() -> consumer.consumeTerminationRequest(
                new ConsoleTerminationRequest(null, "pve1", "docker", 200, null)));
        assertDoesNotThrow(() -> consumer.consumeTerminationRequest(new ConsoleTerminationRequest()));
        verify(relayService, never()).terminateResource(any(), anyString());
    }

    @Test
    void failureInRelayIsContained() {
        when(relayService.terminate("s-1", ConsoleTerminationConsumer.DEFAULT_REASON))
                .thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> consumer.consumeTerminationRequest(
                new ConsoleTerminationRequest("s-1", null, null, null, " ")));
    }
}
