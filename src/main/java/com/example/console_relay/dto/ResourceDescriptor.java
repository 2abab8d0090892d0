package com.example.console_relay.dto;

import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * Identifies one console target: a VM or container on a Proxmox node.
 */
@Value
public class ResourceDescriptor {

    private static final Pattern NODE_NAME = Pattern.compile("[A-Za-z0-9._-]+");

    String node;
    ResourceKind kind;
    int resourceId;

    public static ResourceDescriptor of(String node, String resourceId, String resourceKind) {
        if (node == null || node.isBlank()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "node is required");
        }
        if (!NODE_NAME.matcher(node).matches()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Invalid node name: " + node);
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "resourceId is required");
        }
        int id;
        try {
            id = Integer.parseInt(resourceId.trim());
        } catch (NumberFormatException e) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Invalid resourceId: " + resourceId);
        }
        return of(node, id, ResourceKind.parse(resourceKind));
    }

    public static ResourceDescriptor of(String node, int resourceId, ResourceKind kind) {
        if (node == null || !NODE_NAME.matcher(node).matches()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Invalid node name: " + node);
        }
        if (resourceId <= 0) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "resourceId must be positive");
        }
        if (kind == null) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "resource_type is required");
        }
        return new ResourceDescriptor(node, kind, resourceId);
    }

    @Override
    public String toString() {
        return node + "/" + kind.getWireName() + "/" + resourceId;
    }
}
