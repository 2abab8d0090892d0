package com.example.console_relay.service;

import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.dto.ResourceKind;
import com.example.console_relay.session.ConsoleSession;
import com.example.console_relay.support.RecordingWebSocketSession;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConsoleMaintenanceServiceTest {

    private static final ResourceDescriptor RESOURCE = ResourceDescriptor.of("pve1", 101, ResourceKind.VM);
    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");

    private ConsoleSessionRegistry registry;
    private ConsoleRelayService relayService;
    private ConsoleMaintenanceService maintenance;

    @BeforeEach
    void setUp() {
        registry = new ConsoleSessionRegistry(10);
        relayService = mock(ConsoleRelayService.class);
    }

    @AfterEach
    void tearDown() {
        maintenance.shutdown();
    }

    @Test
    void idleSessionsAreTerminated() {
        maintenance = newMaintenance(Duration.ofMinutes(10));
        ConsoleSession session = registeredSession();
        when(relayService.terminate(session.getId(), ConsoleMaintenanceService.IDLE_REASON)).thenReturn(true);

        assertEquals(0, maintenance.closeIdleSessions(CREATED.plus(Duration.ofMinutes(5))));
        assertEquals(1, maintenance.closeIdleSessions(CREATED.plus(Duration.ofMinutes(11))));
        verify(relayService).terminate(session.getId(), ConsoleMaintenanceService.IDLE_REASON);
    }

    @Test
    void zeroIdleTimeoutDisablesIdleCheck() {
        maintenance = newMaintenance(Duration.ZERO);
        ConsoleSession session = registeredSession();

        assertEquals(0, maintenance.closeIdleSessions(CREATED.plus(Duration.ofDays(1))));
        verify(relayService, never()).terminate(session.getId(), ConsoleMaintenanceService.IDLE_REASON);
    }

    private ConsoleMaintenanceService newMaintenance(Duration idleTimeout) {
        return new ConsoleMaintenanceService(new ConsoleTicketStore(Duration.ofMinutes(5)), registry, relayService,
                Clock.fixed(CREATED, ZoneOffset.UTC), Duration.ofHours(1), idleTimeout);
    }

    private ConsoleSession registeredSession() {
        ConsoleSession session = new ConsoleSession(new RecordingWebSocketSession("c"), RESOURCE,
                Clock.fixed(CREATED, ZoneOffset.UTC), 16, 1000, 1024);
        registry.register(session);
        return session;
    }
}
