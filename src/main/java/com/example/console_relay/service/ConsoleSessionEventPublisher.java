package com.example.console_relay.service;

import com.example.console_relay.dto.ConsoleSessionEvent;

/**
 * Hands session lifecycle events to the audit collaborator.
 */
public interface ConsoleSessionEventPublisher {

    void publish(ConsoleSessionEvent event);
}
