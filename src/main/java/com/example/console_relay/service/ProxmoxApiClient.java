package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleProtocol;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;

/**
 * Thin wrapper over the Proxmox VE REST API. Every call unwraps the {@code data} envelope
 * and maps transport and status failures onto {@link RelayFailure}.
 */
@Service
@Slf4j
public class ProxmoxApiClient {

    private static final String RESOURCE_PATH = "/nodes/{node}/{kind}/{vmid}";

    private final RestClient restClient;

    public ProxmoxApiClient(@Qualifier("proxmoxRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public JsonNode getStatus(ResourceDescriptor resource) {
        return get(resource, RESOURCE_PATH + "/status/current");
    }

    public JsonNode getConfig(ResourceDescriptor resource) {
        return get(resource, RESOURCE_PATH + "/config");
    }

    /**
     * Asks Proxmox to open a console proxy for the resource. The answer carries the
     * {@code ticket}, the {@code port} it listens on and the {@code user} it was issued for.
     */
    public JsonNode createConsoleProxy(ResourceDescriptor resource, ConsoleProtocol protocol) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        if (protocol == ConsoleProtocol.VNC) {
            form.add("websocket", "1");
        }
        try {
            JsonNode body = restClient.post()
                    .uri(RESOURCE_PATH + "/" + protocol.getProxyEndpoint(),
                            resource.getNode(), resource.getKind().getWireName(), resource.getResourceId())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
            return unwrap(body);
        } catch (RestClientException e) {
            throw translate(resource, protocol.getProxyEndpoint(), e);
        }
    }

    private JsonNode get(ResourceDescriptor resource, String path) {
        try {
            JsonNode body = restClient.get()
                    .uri(path, resource.getNode(), resource.getKind().getWireName(), resource.getResourceId())
                    .retrieve()
                    .body(JsonNode.class);
            return unwrap(body);
        } catch (RestClientException e) {
            throw translate(resource, path, e);
        }
    }

    private static JsonNode unwrap(JsonNode body) {
        if (body == null || !body.has("data")) {
            return NullNode.getInstance();
        }
        return body.get("data");
    }

    ConsoleRelayException translate(ResourceDescriptor resource, String call, RestClientException e) {
        if (e instanceof RestClientResponseException) {
            RestClientResponseException response = (RestClientResponseException) e;
            int status = response.getStatusCode().value();
            String detail = (response.getStatusText() + " " + response.getResponseBodyAsString()).trim();
            log.warn("Proxmox API {} for {} answered {}: {}", call, resource, status, detail);
            if (status == HttpStatus.NOT_FOUND.value() || mentionsMissingResource(detail)) {
                return new ConsoleRelayException(RelayFailure.RESOURCE_NOT_FOUND, resource + " does not exist", e);
            }
            return new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                    "Proxmox API error " + status + " for " + resource, e);
        }
        if (e instanceof ResourceAccessException) {
            log.error("Proxmox API unreachable during {} for {}: {}", call, resource, e.getMessage());
            return new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "Proxmox API unreachable", e);
        }
        log.error("Unexpected Proxmox API failure during {} for {}: {}", call, resource, e.getMessage());
        return new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE, "Proxmox API call failed", e);
    }

    private static boolean mentionsMissingResource(String detail) {
        String lower = detail.toLowerCase(Locale.ROOT);
        return lower.contains("does not exist") || lower.contains("no such");
    }
}
