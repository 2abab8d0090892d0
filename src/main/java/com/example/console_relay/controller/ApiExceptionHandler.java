package com.example.console_relay.controller;

import com.example.console_relay.dto.ErrorResponse;
import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(ConsoleRelayException.class)
    public ResponseEntity<ErrorResponse> handleRelayFailure(ConsoleRelayException e) {
        RelayFailure failure = e.getFailure();
        if (failure == RelayFailure.INTERNAL_ERROR) {
            log.error("Request failed: {}", e.getMessage(), e);
        } else {
            log.info("Request refused: {} ({})", failure, e.getMessage());
        }
        return ResponseEntity.status(failure.getHttpStatus())
                .body(new ErrorResponse(failure.name(), e.getMessage()));
    }
}
