package com.example.console_relay.handler;

import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.Value;

import java.util.Map;

/**
 * Connection parameters of one relay request, taken from the handshake attributes.
 */
@Value
public class RelayRequest {

    public static final String ATTR_NODE = "node";
    public static final String ATTR_RESOURCE_ID = "resourceId";
    public static final String ATTR_RESOURCE_TYPE = "resource_type";
    public static final String ATTR_TICKET = "ticket";
    public static final String ATTR_PORT = "port";
    public static final String ATTR_TOKEN = "token";

    ResourceDescriptor resource;
    String ticket;
    int port;
    String token;

    public static RelayRequest fromAttributes(Map<String, Object> attributes) {
        ResourceDescriptor resource = ResourceDescriptor.of(
                text(attributes, ATTR_NODE),
                text(attributes, ATTR_RESOURCE_ID),
                text(attributes, ATTR_RESOURCE_TYPE));

        String ticket = text(attributes, ATTR_TICKET);
        if (ticket == null || ticket.isEmpty()) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "ticket is required");
        }

        String portText = text(attributes, ATTR_PORT);
        int port;
        try {
            port = Integer.parseInt(portText == null ? "" : portText.trim());
        } catch (NumberFormatException e) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Invalid port: " + portText);
        }
        if (port <= 0 || port > 65535) {
            throw new ConsoleRelayException(RelayFailure.BAD_REQUEST, "Invalid port: " + portText);
        }

        return new RelayRequest(resource, ticket, port, text(attributes, ATTR_TOKEN));
    }

    private static String text(Map<String, Object> attributes, String key) {
        Object value = attributes.get(key);
        return value == null ? null : value.toString();
    }

    @Override
    public String toString() {
        return "RelayRequest(" + resource + ", port=" + port + ")";
    }
}
