package com.example.console_relay.exception;

import lombok.Getter;
import org.springframework.web.socket.CloseStatus;

@Getter
public class ConsoleRelayException extends RuntimeException {

    private final RelayFailure failure;

    public ConsoleRelayException(RelayFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public ConsoleRelayException(RelayFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public CloseStatus toCloseStatus() {
        return RelayCloseCodes.status(failure.getCloseCode(), failure.getReasonPrefix() + ": " + getMessage());
    }
}
