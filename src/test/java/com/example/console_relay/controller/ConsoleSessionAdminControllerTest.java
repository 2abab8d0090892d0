package com.example.console_relay.controller;

import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.dto.ResourceKind;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.example.console_relay.service.ConsoleRelayService;
import com.example.console_relay.service.ConsoleSessionRegistry;
import com.example.console_relay.service.OperatorIdentityService;
import com.example.console_relay.session.ConsoleSession;
import com.example.console_relay.support.RecordingWebSocketSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class ConsoleSessionAdminControllerTest {

    private static final String ADMIN = "Bearer admin-token";

    private OperatorIdentityService identityService;
    private ConsoleSessionRegistry registry;
    private ConsoleRelayService relayService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        identityService = mock(OperatorIdentityService.class);
        registry = new ConsoleSessionRegistry(10);
        relayService = mock(ConsoleRelayService.class);
        when(identityService.requireAdmin(ADMIN)).thenReturn(new OperatorIdentity(1L, "root@example.com", "admin"));
        mvc = MockMvcBuilders
                .standaloneSetup(new ConsoleSessionAdminController(identityService, registry, relayService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void listsOpenSessions() throws Exception {
        ConsoleSession session = new ConsoleSession(new RecordingWebSocketSession("c"),
                ResourceDescriptor.of("pve1", 101, ResourceKind.VM), Clock.systemUTC(), 16, 1000, 1024);
        session.setOperatorId(7L);
        registry.register(session);

        mvc.perform(get("/api/shell/sessions").header(HttpHeaders.AUTHORIZATION, ADMIN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(session.getId()))
                .andExpect(jsonPath("$[0].node").value("pve1"))
                .andExpect(jsonPath("$[0].resourceKind").value("qemu"))
                .andExpect(jsonPath("$[0].operatorId").value(7));
    }

    @Test
    void nonAdminIsForbidden() throws Exception {
        when(identityService.requireAdmin("Bearer op"))
                .thenThrow(new ConsoleRelayException(RelayFailure.UNAUTHORIZED, "admin role required"));

        mvc.perform(get("/api/shell/sessions").header(HttpHeaders.AUTHORIZATION, "Bearer op"))
                .andExpect(status().isForbidden());
    }

    @Test
    void terminateKnownSession() throws Exception {
        when(relayService.terminate("s-1", "maintenance")).thenReturn(true);

        mvc.perform(delete("/api/shell/sessions/s-1").param("reason", "maintenance")
                        .header(HttpHeaders.AUTHORIZATION, ADMIN))
                .andExpect(status().isNoContent());
        verify(relayService).terminate("s-1", "maintenance");
    }

    @Test
    void terminateUnknownSessionIsNotFound() throws Exception {
        when(relayService.terminate("nope", ConsoleSessionAdminController.DEFAULT_REASON)).thenReturn(false);

        mvc.perform(delete("/api/shell/sessions/nope").header(HttpHeaders.AUTHORIZATION, ADMIN))
                .andExpect(status().isNotFound());
    }
}
