package com.example.console_relay.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Failure taxonomy shared by the ticket endpoint and the relay endpoint.
 * Every failure is terminal for the call or session that raised it.
 */
@Getter
@RequiredArgsConstructor
public enum RelayFailure {

    BAD_REQUEST(RelayCloseCodes.BAD_REQUEST, HttpStatus.BAD_REQUEST, "Bad request"),
    UNAUTHORIZED(RelayCloseCodes.UNAUTHORIZED, HttpStatus.FORBIDDEN, "Unauthorized"),
    UNAUTHENTICATED(RelayCloseCodes.UNAUTHORIZED, HttpStatus.UNAUTHORIZED, "Unauthorized"),
    TICKET_EXPIRED(RelayCloseCodes.AUTHENTICATION_FAILED, HttpStatus.UNAUTHORIZED, "Authentication failed"),
    TICKET_INVALID(RelayCloseCodes.AUTHENTICATION_FAILED, HttpStatus.UNAUTHORIZED, "Authentication failed"),
    UPSTREAM_AUTH_FAILED(RelayCloseCodes.AUTHENTICATION_FAILED, HttpStatus.BAD_GATEWAY, "Authentication failed"),
    UPSTREAM_UNREACHABLE(RelayCloseCodes.UPSTREAM_UNREACHABLE, HttpStatus.BAD_GATEWAY, "Upstream unreachable"),
    RESOURCE_NOT_FOUND(RelayCloseCodes.BAD_REQUEST, HttpStatus.NOT_FOUND, "Resource not found"),
    RESOURCE_NOT_RUNNING(RelayCloseCodes.UPSTREAM_UNREACHABLE, HttpStatus.CONFLICT, "Resource not running"),
    SESSION_LIMIT_EXCEEDED(RelayCloseCodes.SESSION_LIMIT_EXCEEDED, HttpStatus.SERVICE_UNAVAILABLE, "Session limit exceeded"),
    INTERNAL_ERROR(RelayCloseCodes.INTERNAL_ERROR, HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");

    private final int closeCode;
    private final HttpStatus httpStatus;
    private final String reasonPrefix;
}
