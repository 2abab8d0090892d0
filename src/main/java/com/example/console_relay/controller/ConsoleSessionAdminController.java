package com.example.console_relay.controller;

import com.example.console_relay.dto.ConsoleSessionView;
import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.service.ConsoleRelayService;
import com.example.console_relay.service.ConsoleSessionRegistry;
import com.example.console_relay.service.OperatorIdentityService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/shell/sessions")
@RequiredArgsConstructor
@Slf4j
public class ConsoleSessionAdminController {

    static final String DEFAULT_REASON = "terminated by administrator";

    private final OperatorIdentityService identityService;
    private final ConsoleSessionRegistry registry;
    private final ConsoleRelayService relayService;

    @GetMapping
    public List<ConsoleSessionView> listSessions(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        identityService.requireAdmin(authorization);
        return registry.views();
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> terminateSession(
            @PathVariable String sessionId,
            @RequestParam(name = "reason", required = false) String reason,
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        OperatorIdentity admin = identityService.requireAdmin(authorization);
        String effectiveReason = reason == null || reason.isBlank() ? DEFAULT_REASON : reason;
        if (!relayService.terminate(sessionId, effectiveReason)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Admin {} terminated console session {}", admin.getId(), sessionId);
        return ResponseEntity.noContent().build();
    }
}
