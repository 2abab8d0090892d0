package com.example.console_relay.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Proxmox console flavour. {@code VNC} authenticates with the upgrade request alone,
 * {@code TERM} additionally expects a {@code user:ticket} line answered by {@code OK}.
 */
@Getter
@RequiredArgsConstructor
public enum ConsoleProtocol {

    VNC("vncproxy"),
    TERM("termproxy");

    private final String proxyEndpoint;
}
