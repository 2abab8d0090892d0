package com.example.console_relay.service;

import com.example.console_relay.dto.OperatorIdentity;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Resolves an operator bearer token through the external identity service.
 */
@Service
@Slf4j
public class OperatorIdentityService {

    private static final String BEARER_PREFIX = "Bearer ";

    private final RestClient restClient;

    public OperatorIdentityService(@Qualifier("identityRestClient") RestClient restClient) {
        this.restClient = restClient;
    }

    public OperatorIdentity resolveAuthorizationHeader(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            throw new ConsoleRelayException(RelayFailure.UNAUTHENTICATED, "bearer token required");
        }
        return resolve(authorization.substring(BEARER_PREFIX.length()).trim());
    }

    public OperatorIdentity resolve(String token) {
        if (token == null || token.isBlank()) {
            throw new ConsoleRelayException(RelayFailure.UNAUTHENTICATED, "token is required");
        }
        OperatorIdentity identity;
        try {
            identity = restClient.get()
                    .uri("/api/auth/me")
                    .header(HttpHeaders.AUTHORIZATION, BEARER_PREFIX + token)
                    .retrieve()
                    .body(OperatorIdentity.class);
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == HttpStatus.UNAUTHORIZED.value() || status == HttpStatus.FORBIDDEN.value()) {
                throw new ConsoleRelayException(RelayFailure.UNAUTHENTICATED, "invalid or expired token", e);
            }
            log.error("Identity service answered {}: {}", status, e.getMessage());
            throw new ConsoleRelayException(RelayFailure.INTERNAL_ERROR, "identity service error", e);
        } catch (RestClientException e) {
            log.error("Identity service unreachable: {}", e.getMessage());
            throw new ConsoleRelayException(RelayFailure.INTERNAL_ERROR, "identity service unreachable", e);
        }
        if (identity == null || identity.getId() == null) {
            throw new ConsoleRelayException(RelayFailure.UNAUTHENTICATED, "token did not resolve to an operator");
        }
        return identity;
    }

    public OperatorIdentity requireAdmin(String authorization) {
        OperatorIdentity identity = resolveAuthorizationHeader(authorization);
        if (!identity.isAdmin()) {
            throw new ConsoleRelayException(RelayFailure.UNAUTHORIZED, "admin role required");
        }
        return identity;
    }
}
