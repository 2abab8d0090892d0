package com.example.console_relay.session;

import com.example.console_relay.exception.ConsoleRelayException;
import com.example.console_relay.exception.RelayCloseCodes;
import com.example.console_relay.exception.RelayFailure;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.web.socket.CloseStatus;

/**
 * Why a console session ended: what the operator's terminal is told, what the upstream
 * console is told, and whether the session counts as errored.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class SessionOutcome {

    private final CloseStatus clientStatus;
    private final CloseStatus upstreamStatus;
    private final boolean errored;
    private final RelayFailure failure;
    private final String description;

    public static SessionOutcome clientClosed(CloseStatus status) {
        boolean clean = isClean(status);
        return new SessionOutcome(
                RelayCloseCodes.status(RelayCloseCodes.NORMAL, "Session closed: client disconnected"),
                CloseStatus.NORMAL,
                !clean,
                null,
                "client closed (" + status.getCode() + ")");
    }

    public static SessionOutcome clientFailed(Throwable error) {
        return new SessionOutcome(
                CloseStatus.SERVER_ERROR,
                CloseStatus.GOING_AWAY,
                true,
                null,
                "client transport error: " + error.getMessage());
    }

    public static SessionOutcome upstreamClosed(CloseStatus status) {
        if (isClean(status)) {
            return new SessionOutcome(
                    RelayCloseCodes.status(RelayCloseCodes.NORMAL, "Session closed: console ended"),
                    CloseStatus.NORMAL,
                    false,
                    null,
                    "upstream closed (" + status.getCode() + ")");
        }
        return failed(new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                "console connection lost (" + status.getCode() + ")"));
    }

    public static SessionOutcome upstreamFailed(Throwable error) {
        return failed(new ConsoleRelayException(RelayFailure.UPSTREAM_UNREACHABLE,
                "console transport error: " + error.getMessage(), error));
    }

    public static SessionOutcome failed(ConsoleRelayException e) {
        return new SessionOutcome(
                e.toCloseStatus(),
                CloseStatus.GOING_AWAY,
                true,
                e.getFailure(),
                e.getFailure() + ": " + e.getMessage());
    }

    public static SessionOutcome terminated(String reason) {
        return new SessionOutcome(
                RelayCloseCodes.status(RelayCloseCodes.TERMINATED, "Session terminated: " + reason),
                CloseStatus.GOING_AWAY,
                false,
                null,
                "terminated: " + reason);
    }

    private static boolean isClean(CloseStatus status) {
        int code = status.getCode();
        return code == CloseStatus.NORMAL.getCode() || code == CloseStatus.GOING_AWAY.getCode();
    }

    @Override
    public String toString() {
        return description;
    }
}
