package com.example.console_relay.service;

import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.dto.ResourceDescriptor;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;

/**
 * Admits admins everywhere and other operators only on resources tagged
 * {@code ucp-owner:<operatorId>} in Proxmox.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OwnerTagAdmissionGate implements AdmissionGate {

    static final String OWNER_TAG_PREFIX = "ucp-owner:";

    private final ProxmoxApiClient proxmoxApiClient;

    @Override
    public void admit(OperatorIdentity operator, ResourceDescriptor resource) {
        if (operator == null || operator.getId() == null) {
            throw new ConsoleRelayException(RelayFailure.UNAUTHORIZED, "no operator identity");
        }

        // also proves the resource exists
        String tags = proxmoxApiClient.getConfig(resource).path("tags").asText("");

        if (operator.isAdmin()) {
            return;
        }
        String ownerTag = OWNER_TAG_PREFIX + operator.getId();
        boolean owner = Arrays.stream(tags.split("[;,\\s]+"))
                .anyMatch(ownerTag::equals);
        if (!owner) {
            log.warn("Operator {} denied console access to {}", operator.getId(), resource);
            throw new ConsoleRelayException(RelayFailure.UNAUTHORIZED, "not your resource");
        }
    }
}
