package com.example.console_relay.config;

import com.example.console_relay.handler.RelayRequest;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RelayRequestInterceptorTest {

    private final WebSocketConfig.RelayRequestInterceptor interceptor = new WebSocketConfig.RelayRequestInterceptor();

    @Test
    void copiesPathAndQueryIntoAttributes() {
        Map<String, Object> attributes = handshake("/api/shell/ws/pve1/101",
                "ticket=PVEVNC%3Aabc%2B%2F%3D&port=5900&resource_type=lxc&token=t0k");

        assertEquals("pve1", attributes.get(RelayRequest.ATTR_NODE));
        assertEquals("101", attributes.get(RelayRequest.ATTR_RESOURCE_ID));
        assertEquals("PVEVNC:abc+/=", attributes.get(RelayRequest.ATTR_TICKET));
        assertEquals("5900", attributes.get(RelayRequest.ATTR_PORT));
        assertEquals("lxc", attributes.get(RelayRequest.ATTR_RESOURCE_TYPE));
        assertEquals("t0k", attributes.get(RelayRequest.ATTR_TOKEN));
    }

    @Test
    void resourceTypeDefaultsToQemu() {
        Map<String, Object> attributes = handshake("/api/shell/ws/pve1/101", "ticket=x&port=5900");

        assertEquals("qemu", attributes.get(RelayRequest.ATTR_RESOURCE_TYPE));
        assertFalse(attributes.containsKey(RelayRequest.ATTR_TOKEN));
    }

    @Test
    void missingParametersStillUpgradeSoTheyCanBeRejectedWithCloseCode() {
        Map<String, Object> attributes = new HashMap<>();
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/shell/ws/pve1/101");

        assertTrue(interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()), new TextWebSocketHandler(), attributes));
        assertFalse(attributes.containsKey(RelayRequest.ATTR_TICKET));
    }

    private Map<String, Object> handshake(String path, String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", path);
        request.setQueryString(query);
        Map<String, Object> attributes = new HashMap<>();
        assertTrue(interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(new MockHttpServletResponse()), new TextWebSocketHandler(), attributes));
        return attributes;
    }
}
