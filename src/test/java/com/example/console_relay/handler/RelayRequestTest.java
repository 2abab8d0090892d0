package com.example.console_relay.handler;

import com.example.console_relay.dto.ResourceKind;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayRequestTest {

    @Test
    void parsesHandshakeAttributes() {
        RelayRequest request = RelayRequest.fromAttributes(attributes("pve1", "200", "lxc", "PVEVNC:abc", "5901"));

        assertEquals("pve1", request.getResource().getNode());
        assertEquals(ResourceKind.CONTAINER, request.getResource().getKind());
        assertEquals(200, request.getResource().getResourceId());
        assertEquals("PVEVNC:abc", request.getTicket());
        assertEquals(5901, request.getPort());
        assertEquals("tok", request.getToken());
        assertFalse(request.toString().contains("PVEVNC:abc"));
    }

    @Test
    void ticketIsRequired() {
        assertBadRequest(attributes("pve1", "101", "qemu", null, "5900"));
        assertBadRequest(attributes("pve1", "101", "qemu", "", "5900"));
    }

    @Test
    void portMustBeValid() {
        assertBadRequest(attributes("pve1", "101", "qemu", "t", null));
        assertBadRequest(attributes("pve1", "101", "qemu", "t", "vnc"));
        assertBadRequest(attributes("pve1", "101", "qemu", "t", "0"));
        assertBadRequest(attributes("pve1", "101", "qemu", "t", "70000"));
    }

    @Test
    void resourceMustBeValid() {
        assertBadRequest(attributes("pve 1", "101", "qemu", "t", "5900"));
        assertBadRequest(attributes("pve1", "abc", "qemu", "t", "5900"));
        assertBadRequest(attributes("pve1", "101", "docker", "t", "5900"));
    }

    private static void assertBadRequest(Map<String, Object> attributes) {
        ConsoleRelayException e = assertThrows(ConsoleRelayException.class, () -> RelayRequest.fromAttributes(attributes));
        assertEquals(RelayFailure.BAD_REQUEST, e.getFailure());
    }

    private static Map<String, Object> attributes(String node, String resourceId, String type, String ticket, String port) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put(RelayRequest.ATTR_NODE, node);
        attributes.put(RelayRequest.ATTR_RESOURCE_ID, resourceId);
        attributes.put(RelayRequest.ATTR_RESOURCE_TYPE, type);
        attributes.put(RelayRequest.ATTR_TOKEN, "tok");
        if (ticket != null) {
            attributes.put(RelayRequest.ATTR_TICKET, ticket);
        }
        if (port != null) {
            attributes.put(RelayRequest.ATTR_PORT, port);
        }
        return attributes;
    }
}
