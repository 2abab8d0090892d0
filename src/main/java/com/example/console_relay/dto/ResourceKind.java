package com.example.console_relay.dto;

import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

/**
 * Console target discriminator. The wire name is the Proxmox API path segment.
 */
@Getter
@RequiredArgsConstructor
public enum ResourceKind {

    VM("qemu"),
    CONTAINER("lxc");

    private final String wireName;

    @JsonValue
    public String toWire() {
        return wireName;
    }

    @JsonCreator
    public static ResourceKind parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "resource_type is required");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "qemu":
            case "vm":
                return VM;
            case "lxc":
            case "ct":
            case "container":
                return CONTAINER;
            default:
                throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Unsupported resource_type: " + value);
        }
    }
}
