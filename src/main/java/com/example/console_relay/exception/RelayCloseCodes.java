package com.example.console_relay.exception;

import org.springframework.web.socket.CloseStatus;

import java.nio.charset.StandardCharsets;

/**
 * WebSocket close codes sent to the operator's terminal. Application codes live in the
 * 4000-4999 private range so the browser can tell the failures apart.
 */
public final class RelayCloseCodes {

    public static final int NORMAL = 1000;
    public static final int INTERNAL_ERROR = 1011;
    public static final int BAD_REQUEST = 4400;
    public static final int AUTHENTICATION_FAILED = 4401;
    public static final int UNAUTHORIZED = 4403;
    public static final int TERMINATED = 4410;
    public static final int SESSION_LIMIT_EXCEEDED = 4429;
    public static final int UPSTREAM_UNREACHABLE = 4502;

    // RFC 6455: control frame payload is 125 bytes, 2 of them hold the code
    private static final int MAX_REASON_BYTES = 123;

    private RelayCloseCodes() {
    }

    public static CloseStatus status(int code, String reason) {
        return new CloseStatus(code, truncate(reason));
    }

    static String truncate(String reason) {
        if (reason == null) {
            return null;
        }
        byte[] bytes = reason.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_REASON_BYTES) {
            return reason;
        }
        int end = reason.length();
        while (end > 0 && reason.substring(0, end).getBytes(StandardCharsets.UTF_8).length > MAX_REASON_BYTES) {
            end--;
        }
        if (end > 0 && Character.isHighSurrogate(reason.charAt(end - 1))) {
            end--;
        }
        return reason.substring(0, end);
    }
}
