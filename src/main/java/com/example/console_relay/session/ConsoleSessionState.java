package com.example.console_relay.session;

public enum ConsoleSessionState {
    ADMITTED,
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED,
    ERRORED;

    public boolean isTerminal() {
        return this == CLOSED || this == ERRORED;
    }
}
