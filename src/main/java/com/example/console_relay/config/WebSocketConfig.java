package com.example.console_relay.config;

import com.example.console_relay.handler.ConsoleRelayHandler;
import com.example.console_relay.handler.RelayRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Map;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    static final String RELAY_PATH_PREFIX = "/api/shell/ws/";

    private final ConsoleRelayHandler consoleRelayHandler;

    @Value("${relay.allowed-origins:*}")
    private String[] allowedOrigins;

    @Value("${relay.session.max-message-size:65536}")
    private int maxMessageSize;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(consoleRelayHandler, RELAY_PATH_PREFIX + "{node}/{resourceId}")
                .addInterceptors(new RelayRequestInterceptor())
                .setAllowedOriginPatterns(allowedOrigins);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(maxMessageSize);
        container.setMaxBinaryMessageBufferSize(maxMessageSize);
        return container;
    }

    /**
     * Copies path variables and query parameters into the session attributes. Validation
     * happens after the upgrade so that rejections reach the browser as close codes.
     */
    static class RelayRequestInterceptor implements HandshakeInterceptor {

        @Override
        public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                       WebSocketHandler wsHandler, Map<String, Object> attributes) {
            String path = request.getURI().getRawPath();
            int start = path.indexOf(RELAY_PATH_PREFIX);
            if (start < 0) {
                log.error("Relay handshake on unexpected path: {}", path);
                return false;
            }
            String[] segments = path.substring(start + RELAY_PATH_PREFIX.length()).split("/");
            if (segments.length >= 2) {
                attributes.put(RelayRequest.ATTR_NODE, decode(segments[0]));
                attributes.put(RelayRequest.ATTR_RESOURCE_ID, decode(segments[1]));
            }

            MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI())
                    .build()
                    .getQueryParams();
            copy(query, "ticket", RelayRequest.ATTR_TICKET, attributes);
            copy(query, "port", RelayRequest.ATTR_PORT, attributes);
            copy(query, "resource_type", RelayRequest.ATTR_RESOURCE_TYPE, attributes);
            copy(query, "token", RelayRequest.ATTR_TOKEN, attributes);
            if (!attributes.containsKey(RelayRequest.ATTR_RESOURCE_TYPE)) {
                attributes.put(RelayRequest.ATTR_RESOURCE_TYPE, "qemu");
            }
            return true;
        }

        @Override
        public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Exception exception) {
            if (exception != null) {
                log.error("Relay WebSocket handshake failed", exception);
            }
        }

        private static void copy(MultiValueMap<String, String> query, String param, String attribute,
                                 Map<String, Object> attributes) {
            String value = query.getFirst(param);
            if (value != null) {
                attributes.put(attribute, decode(value));
            }
        }

        private static String decode(String value) {
            return UriUtils.decode(value, StandardCharsets.UTF_8);
        }
    }
}
