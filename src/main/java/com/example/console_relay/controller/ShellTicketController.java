package com.example.console_relay.controller;

import com.example.console_relay.dto.ConsoleTicket;
import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.dto.TicketResponse;
import com.example.console_relay.service.AdmissionGate;
import com.example.console_relay.service.ConsoleTicketStore;
import com.example.console_relay.service.OperatorIdentityService;
import com.example.console_relay.service.TicketExchangeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Issues the short-lived ticket a browser needs before it may open the relay WebSocket.
 */
@RestController
@RequestMapping("/api/shell")
@RequiredArgsConstructor
@Slf4j
public class ShellTicketController {

    private final OperatorIdentityService identityService;
    private final AdmissionGate admissionGate;
    private final TicketExchangeService ticketExchangeService;
    private final ConsoleTicketStore ticketStore;

    @GetMapping("/ticket/{node}/{vmid}")
    public TicketResponse issueTicket(@PathVariable String node,
                                      @PathVariable String vmid,
                                      @RequestParam(name = "resource_type", defaultValue = "qemu") String resourceType,
                                      @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        ResourceDescriptor resource = ResourceDescriptor.of(node, vmid, resourceType);
        OperatorIdentity operator = identityService.resolveAuthorizationHeader(authorization);
        admissionGate.admit(operator, resource);

        ConsoleTicket ticket = ticketExchangeService.mint(operator, resource);
        ticketStore.register(ticket);
        log.info("Issued console ticket for {} to operator {}", resource, operator.getId());
        return TicketResponse.from(ticket);
    }
}
