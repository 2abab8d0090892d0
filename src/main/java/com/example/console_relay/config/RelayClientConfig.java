package com.example.console_relay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.net.Socket;
import java.net.http.HttpClient;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Outbound clients: the Proxmox REST API, the identity service and the console
 * WebSocket endpoint.
 */
@Configuration
@Slf4j
public class RelayClientConfig {

    // Tomcat WebSocket client user properties
    private static final String TOMCAT_SSL_CONTEXT = "org.apache.tomcat.websocket.SSL_CONTEXT";
    private static final String TOMCAT_IO_TIMEOUT = "org.apache.tomcat.websocket.IO_TIMEOUT_MS";

    @Value("${proxmox.verify-ssl:false}")
    private boolean verifySsl;

    @Value("${relay.upstream.connect-timeout:5s}")
    private Duration connectTimeout;

    @Bean
    public SSLContext proxmoxSslContext() throws GeneralSecurityException {
        if (verifySsl) {
            return SSLContext.getDefault();
        }
        log.warn("Proxmox TLS certificate verification is disabled");
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, new TrustManager[]{new TrustAllManager()}, null);
        return context;
    }

    @Bean
    public RestClient proxmoxRestClient(@Qualifier("proxmoxSslContext") SSLContext sslContext,
                                        @Value("${proxmox.scheme:https}") String scheme,
                                        @Value("${proxmox.host}") String host,
                                        @Value("${proxmox.port:8006}") int port,
                                        @Value("${proxmox.token-name:}") String tokenName,
                                        @Value("${proxmox.token-value:}") String tokenValue) {
        HttpClient httpClient = HttpClient.newBuilder()
                .sslContext(sslContext)
                .connectTimeout(connectTimeout)
                .build();
        RestClient.Builder builder = RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(httpClient))
                .baseUrl(scheme + "://" + host + ":" + port + "/api2/json");
        if (!tokenName.isEmpty()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "PVEAPIToken=" + tokenName + "=" + tokenValue);
        }
        return builder.build();
    }

    @Bean
    public RestClient identityRestClient(@Value("${identity.base-url}") String baseUrl) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        return RestClient.builder()
                .requestFactory(new JdkClientHttpRequestFactory(httpClient))
                .baseUrl(baseUrl)
                .build();
    }

    @Bean
    public WebSocketClient consoleWebSocketClient(@Qualifier("proxmoxSslContext") SSLContext sslContext) {
        StandardWebSocketClient client = new StandardWebSocketClient();
        Map<String, Object> userProperties = new HashMap<>();
        userProperties.put(TOMCAT_SSL_CONTEXT, sslContext);
        userProperties.put(TOMCAT_IO_TIMEOUT, String.valueOf(connectTimeout.toMillis()));
        client.setUserProperties(userProperties);
        return client;
    }

    /**
     * Accepts any certificate and skips host name checks. Proxmox ships a self-signed
     * certificate by default.
     */
    static final class TrustAllManager extends X509ExtendedTrustManager {

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {
        }

        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
